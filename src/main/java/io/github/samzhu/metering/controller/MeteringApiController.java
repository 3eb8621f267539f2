package io.github.samzhu.metering.controller;

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.dto.api.DurationResponse;
import io.github.samzhu.metering.dto.api.EventListResponse;
import io.github.samzhu.metering.dto.api.ProjectListResponse;
import io.github.samzhu.metering.dto.api.ResourceListResponse;
import io.github.samzhu.metering.dto.api.UserListResponse;
import io.github.samzhu.metering.dto.api.VolumeListResponse;
import io.github.samzhu.metering.dto.api.VolumeResponse;
import io.github.samzhu.metering.service.MeteringQueryService;

/**
 * 計量查詢 REST API v1。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /v1/users}、{@code GET /v1/sources/{source}/users} - 用戶清單</li>
 *   <li>{@code GET /v1/projects}、{@code GET /v1/sources/{source}/projects} - 專案清單</li>
 *   <li>{@code GET /v1/resources} 及依 user / project / source 過濾的變體 - 資源清單</li>
 *   <li>{@code GET /v1/{owner}/{id}/meters/{meter}} - 原始事件</li>
 *   <li>{@code GET .../meters/{meter}/volume/sum|max} - volume 聚合</li>
 *   <li>{@code GET /v1/resources/{resource}/meters/{meter}/duration} - 事件時間區間</li>
 * </ul>
 *
 * <p>時間參數 {@code start_timestamp}、{@code end_timestamp} 使用 ISO-8601 格式，範圍為左閉右開。
 */
@RestController
@RequestMapping("/v1")
public class MeteringApiController {

    private static final Logger log = LoggerFactory.getLogger(MeteringApiController.class);

    private final MeteringQueryService queryService;

    public MeteringApiController(MeteringQueryService queryService) {
        this.queryService = queryService;
    }

    // ---- users / projects ----

    @GetMapping("/users")
    public ResponseEntity<UserListResponse> listUsers() {
        return ResponseEntity.ok(new UserListResponse(queryService.listUsers(null)));
    }

    @GetMapping("/sources/{source}/users")
    public ResponseEntity<UserListResponse> listUsersBySource(@PathVariable String source) {
        return ResponseEntity.ok(new UserListResponse(queryService.listUsers(source)));
    }

    @GetMapping("/projects")
    public ResponseEntity<ProjectListResponse> listProjects() {
        return ResponseEntity.ok(new ProjectListResponse(queryService.listProjects(null)));
    }

    @GetMapping("/sources/{source}/projects")
    public ResponseEntity<ProjectListResponse> listProjectsBySource(@PathVariable String source) {
        return ResponseEntity.ok(new ProjectListResponse(queryService.listProjects(source)));
    }

    // ---- resources ----

    @GetMapping("/resources")
    public ResponseEntity<ResourceListResponse> listResources(
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return resources(null, null, null, start, end);
    }

    @GetMapping("/users/{user}/resources")
    public ResponseEntity<ResourceListResponse> listUserResources(
            @PathVariable String user,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return resources(user, null, null, start, end);
    }

    @GetMapping("/projects/{project}/resources")
    public ResponseEntity<ResourceListResponse> listProjectResources(
            @PathVariable String project,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return resources(null, project, null, start, end);
    }

    @GetMapping("/sources/{source}/resources")
    public ResponseEntity<ResourceListResponse> listSourceResources(
            @PathVariable String source,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return resources(null, null, source, start, end);
    }

    private ResponseEntity<ResourceListResponse> resources(
            String user, String project, String source, Instant start, Instant end) {
        log.info("API request: listResources user={}, project={}, source={}, period={} to {}",
            user, project, source, start, end);
        return ResponseEntity.ok(new ResourceListResponse(
            queryService.listResources(user, project, source, start, end)));
    }

    // ---- raw events ----

    @GetMapping("/users/{user}/meters/{meter}")
    public ResponseEntity<EventListResponse> listUserEvents(
            @PathVariable String user,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return events(EventFilter.builder().user(user).meter(meter).start(start).end(end).build());
    }

    @GetMapping("/projects/{project}/meters/{meter}")
    public ResponseEntity<EventListResponse> listProjectEvents(
            @PathVariable String project,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return events(EventFilter.builder().project(project).meter(meter).start(start).end(end).build());
    }

    @GetMapping("/resources/{resource}/meters/{meter}")
    public ResponseEntity<EventListResponse> listResourceEvents(
            @PathVariable String resource,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return events(EventFilter.builder().resource(resource).meter(meter).start(start).end(end).build());
    }

    @GetMapping("/sources/{source}/meters/{meter}")
    public ResponseEntity<EventListResponse> listSourceEvents(
            @PathVariable String source,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return events(EventFilter.builder().source(source).meter(meter).start(start).end(end).build());
    }

    private ResponseEntity<EventListResponse> events(EventFilter filter) {
        log.info("API request: listEvents filter={}", filter);
        List<Sample> events = queryService.listRawEvents(filter);
        return ResponseEntity.ok(new EventListResponse(events));
    }

    // ---- aggregation ----

    @GetMapping("/resources/{resource}/meters/{meter}/volume/sum")
    public ResponseEntity<VolumeResponse> getResourceVolumeSum(
            @PathVariable String resource,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        EventFilter filter = EventFilter.builder().resource(resource).meter(meter).start(start).end(end).build();
        log.info("API request: getResourceVolumeSum filter={}", filter);
        return ResponseEntity.ok(new VolumeResponse(queryService.getResourceVolumeSum(filter)));
    }

    @GetMapping("/resources/{resource}/meters/{meter}/volume/max")
    public ResponseEntity<VolumeResponse> getResourceVolumeMax(
            @PathVariable String resource,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        EventFilter filter = EventFilter.builder().resource(resource).meter(meter).start(start).end(end).build();
        log.info("API request: getResourceVolumeMax filter={}", filter);
        return ResponseEntity.ok(new VolumeResponse(queryService.getResourceVolumeMax(filter)));
    }

    @GetMapping("/projects/{project}/meters/{meter}/volume/sum")
    public ResponseEntity<VolumeListResponse> getProjectVolumeSum(
            @PathVariable String project,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        EventFilter filter = EventFilter.builder().project(project).meter(meter).start(start).end(end).build();
        log.info("API request: getProjectVolumeSum filter={}", filter);
        return ResponseEntity.ok(new VolumeListResponse(queryService.getVolumeSum(filter)));
    }

    @GetMapping("/projects/{project}/meters/{meter}/volume/max")
    public ResponseEntity<VolumeListResponse> getProjectVolumeMax(
            @PathVariable String project,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        EventFilter filter = EventFilter.builder().project(project).meter(meter).start(start).end(end).build();
        log.info("API request: getProjectVolumeMax filter={}", filter);
        return ResponseEntity.ok(new VolumeListResponse(queryService.getVolumeMax(filter)));
    }

    /**
     * 資源在指定計量上的事件時間區間。
     *
     * <p>端點：{@code GET /v1/resources/{resource}/meters/{meter}/duration}
     *
     * @return 最早與最晚事件時間，以及相差秒數；沒有事件時欄位皆為 null
     */
    @GetMapping("/resources/{resource}/meters/{meter}/duration")
    public ResponseEntity<DurationResponse> getResourceDuration(
            @PathVariable String resource,
            @PathVariable String meter,
            @RequestParam(name = "start_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(name = "end_timestamp", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        EventFilter filter = EventFilter.builder().resource(resource).meter(meter).start(start).end(end).build();
        log.info("API request: getResourceDuration filter={}", filter);
        return ResponseEntity.ok(DurationResponse.from(queryService.getEventInterval(filter)));
    }
}
