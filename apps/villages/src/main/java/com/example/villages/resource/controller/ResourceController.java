package com.example.villages.resource.controller;

import com.example.villages.common.exception.ResourceNotFoundException;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.common.web.RequestHeaders;
import com.example.villages.resource.dto.ResourcePageResponse;
import com.example.villages.resource.dto.ResourceResponse;
import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.service.ResourceQueryService;
import com.example.villages.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceQueryService resourceService;
    private final UserDirectory userDirectory;

    @GetMapping("/{id}")
    public Mono<ResourceResponse> getResource(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @PathVariable String id,
            ServerHttpRequest request) {

        log.debug("GET /resources/{} - user: {}", StringSanitizer.forLog(id), StringSanitizer.forLog(userId));
        return userDirectory.findViewer(userId)
                .flatMap(viewer -> resourceService.findVisibleById(id, viewer, request))
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(id)));
    }

    @GetMapping
    public Mono<ResourcePageResponse> listResources(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) ResourceStatus status) {

        log.debug("GET /resources - user: {}, page: {}, size: {}, status: {}",
                StringSanitizer.forLog(userId), page, size, status);
        return userDirectory.findViewer(userId)
                .flatMap(viewer -> resourceService.listVisible(viewer, status, page, size));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteResource(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @PathVariable String id,
            ServerHttpRequest request) {

        log.debug("DELETE /resources/{} - user: {}", StringSanitizer.forLog(id), StringSanitizer.forLog(userId));
        return userDirectory.findViewer(userId)
                .flatMap(viewer -> resourceService.delete(id, viewer, request));
    }
}
