package com.example.series_backend.controller;

import com.example.series_backend.dto.SeriesView;
import com.example.series_backend.service.SeriesQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/v1/series")
public class SeriesController {
    private final SeriesQueryService seriesQueryService;

    public SeriesController(SeriesQueryService seriesQueryService) {
        this.seriesQueryService = seriesQueryService;
    }

    @GetMapping("/{id}")
    public SeriesView get(@PathVariable UUID id) {
        return seriesQueryService.get(id);
    }
}
