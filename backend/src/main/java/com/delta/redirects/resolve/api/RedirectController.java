package com.delta.redirects.resolve.api;

import com.delta.redirects.resolve.model.DeliverySummary;
import com.delta.redirects.resolve.model.ExportSummary;
import com.delta.redirects.resolve.model.RedirectRecord;
import com.delta.redirects.resolve.model.ResolutionRunMeta;
import com.delta.redirects.resolve.model.ResolutionRunRequest;
import com.delta.redirects.resolve.model.ResolutionRunSummary;
import com.delta.redirects.resolve.model.StatusResponse;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.delta.redirects.resolve.service.RedirectDeliveryService;
import com.delta.redirects.resolve.service.RedirectExportService;
import com.delta.redirects.resolve.service.RedirectRunOrchestratorService;
import com.delta.redirects.resolve.service.ResolverStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class RedirectController {
    private final RedirectRunOrchestratorService orchestratorService;
    private final ResolverStatusService statusService;
    private final RedirectExportService exportService;
    private final RedirectDeliveryService deliveryService;
    private final RedirectJdbcRepository repository;

    public RedirectController(
        RedirectRunOrchestratorService orchestratorService,
        ResolverStatusService statusService,
        RedirectExportService exportService,
        RedirectDeliveryService deliveryService,
        RedirectJdbcRepository repository
    ) {
        this.orchestratorService = orchestratorService;
        this.statusService = statusService;
        this.exportService = exportService;
        this.deliveryService = deliveryService;
        this.repository = repository;
    }

    @PostMapping("/resolve/run")
    public ResolutionRunSummary run(@RequestBody(required = false) ResolveApiRunRequest request) {
        return orchestratorService.run(toRunRequest(request));
    }

    @PostMapping("/resolve/start")
    public Map<String, Object> start(@RequestBody(required = false) ResolveApiRunRequest request) {
        long runId = orchestratorService.startAsync(toRunRequest(request));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("status", "RUNNING");
        return body;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/redirects")
    public List<RedirectRecord> redirects(
        @RequestParam(name = "minPercent", required = false, defaultValue = "0") double minPercent
    ) {
        RedirectExportService.validatePercent(minPercent);
        return repository.findRedirectsByMinPercent(minPercent);
    }

    @PostMapping("/redirects/export")
    public ExportSummary export(@RequestParam(name = "minPercent", required = false) Double minPercent) {
        return exportService.export(minPercent);
    }

    @PostMapping("/redirects/deliver")
    public DeliverySummary deliver(@RequestParam(name = "minPercent", required = false) Double minPercent) {
        return deliveryService.deliver(minPercent);
    }

    @GetMapping("/runs/{runId}")
    public ResolutionRunMeta runById(@PathVariable("runId") long runId) {
        ResolutionRunMeta run = repository.findRunById(runId);
        if (run == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown run id: " + runId);
        }
        return run;
    }

    private ResolutionRunRequest toRunRequest(ResolveApiRunRequest request) {
        if (request == null) {
            return ResolutionRunRequest.defaults();
        }
        return new ResolutionRunRequest(
            request.errorsFile(),
            request.productsFile(),
            request.catalogFile(),
            request.resetStore(),
            request.skipStatusCheck()
        );
    }
}
