package com.delta.acquisition.acquire.api;

import com.delta.acquisition.acquire.cost.CostController;
import com.delta.acquisition.acquire.model.AcquisitionEvent;
import com.delta.acquisition.acquire.model.AcquisitionOutcome;
import com.delta.acquisition.acquire.model.AcquisitionRequest;
import com.delta.acquisition.acquire.model.BudgetSnapshot;
import com.delta.acquisition.acquire.model.PoolHealthStats;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.persistence.AcquisitionEventRepository;
import com.delta.acquisition.acquire.pool.ResourcePoolManager;
import com.delta.acquisition.acquire.service.AcquisitionOrchestrator;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class AcquisitionController {
    private static final int MAX_EVENT_LIMIT = 500;

    private final AcquisitionOrchestrator orchestrator;
    private final ResourcePoolManager poolManager;
    private final CostController costController;
    private final AcquisitionEventRepository eventRepository;
    private final AcquisitionProperties properties;

    public AcquisitionController(
        AcquisitionOrchestrator orchestrator,
        ResourcePoolManager poolManager,
        CostController costController,
        AcquisitionEventRepository eventRepository,
        AcquisitionProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.poolManager = poolManager;
        this.costController = costController;
        this.eventRepository = eventRepository;
        this.properties = properties;
    }

    @PostMapping("/acquisitions")
    public AcquisitionOutcome acquire(@RequestBody(required = false) AcquisitionApiRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        AcquisitionRequest acquisitionRequest = new AcquisitionRequest(
            request.requestId(),
            request.target(),
            new SearchParameters(request.query(), request.location(), request.maxResults()),
            Boolean.TRUE.equals(request.costSensitive()),
            Boolean.TRUE.equals(request.accuracyCritical())
        );
        return orchestrator.acquire(acquisitionRequest);
    }

    @GetMapping("/pools")
    public List<PoolHealthStats> pools() {
        return poolManager.health();
    }

    @GetMapping("/budget")
    public BudgetSnapshot budget() {
        return costController.snapshot();
    }

    @GetMapping("/acquisitions/events")
    public List<AcquisitionEvent> events(@RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = limit == null ? properties.getEvents().getDefaultListLimit() : limit;
        if (effectiveLimit < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be positive");
        }
        return eventRepository.findRecent(Math.min(effectiveLimit, MAX_EVENT_LIMIT));
    }
}
