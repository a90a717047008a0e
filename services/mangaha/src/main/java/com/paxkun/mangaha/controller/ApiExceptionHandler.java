package com.paxkun.mangaha.controller;

import com.paxkun.mangaha.service.download.AssemblyException;
import com.paxkun.mangaha.service.download.DownloadException;
import com.paxkun.mangaha.service.fetch.NetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps harvester failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NetworkException.class)
    public ResponseEntity<Map<String, Object>> handleNetwork(NetworkException e) {
        Map<String, Object> body = body("network_error", e.getMessage());
        body.put("url", e.getUrl());
        body.put("attempts", e.getAttempts());
        if (e.getStatus() != NetworkException.NO_STATUS) {
            body.put("upstreamStatus", e.getStatus());
        }
        log.warn("⚠️ Upstream fetch failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(DownloadException.class)
    public ResponseEntity<Map<String, Object>> handleDownload(DownloadException e) {
        Map<String, Object> body = body("download_error", e.getMessage());
        body.put("url", e.getUrl());
        log.warn("⚠️ Chapter download failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(AssemblyException.class)
    public ResponseEntity<Map<String, Object>> handleAssembly(AssemblyException e) {
        log.warn("⚠️ Document assembly failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body("assembly_error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("bad_request", e.getMessage()));
    }

    private Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
