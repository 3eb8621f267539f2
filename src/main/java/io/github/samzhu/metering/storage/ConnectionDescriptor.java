package io.github.samzhu.metering.storage;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.util.StringUtils;

/**
 * 解析後的儲存連線字串。
 *
 * <p>格式：{@code scheme://[user:pass@]host[:port]/dbname}
 * <ul>
 *   <li>{@code scheme} - 儲存類型，決定使用哪個儲存引擎（{@code mongodb}、{@code memory}）</li>
 *   <li>{@code user:pass} - 選填，指定時啟動前必須先完成認證</li>
 *   <li>{@code port} - 選填，省略或空白時使用 {@value #DEFAULT_PORT}</li>
 *   <li>{@code dbname} - 資料庫名稱，路徑中的 {@code /} 會被移除</li>
 * </ul>
 *
 * @param dbtype 儲存類型
 * @param dbname 資料庫名稱
 * @param host 主機
 * @param port 連接埠
 * @param username 選填，帳號
 * @param password 選填，密碼
 */
public record ConnectionDescriptor(
    String dbtype,
    String dbname,
    String host,
    int port,
    String username,
    String password
) {

    /** MongoDB 預設連接埠。 */
    public static final int DEFAULT_PORT = 27017;

    private static final Pattern URL = Pattern.compile(
        "^(?<scheme>[A-Za-z][A-Za-z0-9+.-]*)://"
            + "(?:(?<user>[^:@/]+):(?<password>[^@/]+)@)?"
            + "(?<host>[^:/]*)"
            + "(?::(?<port>[^/]*))?"
            + "(?<path>/.*)?$");

    /**
     * 解析連線字串。
     *
     * @param url 連線字串
     * @return 解析結果
     * @throws StorageConfigurationException 格式錯誤或缺少資料庫名稱
     */
    public static ConnectionDescriptor parse(String url) {
        if (!StringUtils.hasText(url)) {
            throw new StorageConfigurationException("Storage connection string is empty");
        }
        Matcher matcher = URL.matcher(url.trim());
        if (!matcher.matches()) {
            throw new StorageConfigurationException("Malformed storage connection string: " + redact(url));
        }

        String path = matcher.group("path");
        String dbname = path == null ? "" : path.replace("/", "");
        if (dbname.isEmpty()) {
            throw new StorageConfigurationException("Missing database name in storage connection string: " + redact(url));
        }

        return new ConnectionDescriptor(
            matcher.group("scheme").toLowerCase(),
            dbname,
            matcher.group("host"),
            parsePort(matcher.group("port"), url),
            matcher.group("user"),
            matcher.group("password"));
    }

    private static int parsePort(String port, String url) {
        if (!StringUtils.hasText(port)) {
            return DEFAULT_PORT;
        }
        try {
            return Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new StorageConfigurationException("Invalid port in storage connection string: " + redact(url), e);
        }
    }

    private static String redact(String url) {
        return url.replaceAll("://[^@/]*@", "://***@");
    }

    public boolean hasCredentials() {
        return username != null;
    }

    @Override
    public String toString() {
        return dbtype + "://" + (hasCredentials() ? username + ":***@" : "") + host + ":" + port + "/" + dbname;
    }
}
