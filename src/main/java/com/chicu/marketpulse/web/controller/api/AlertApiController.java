package com.chicu.marketpulse.web.controller.api;

import com.chicu.marketpulse.alert.AlertService;
import com.chicu.marketpulse.alert.PriceAlert;
import com.chicu.marketpulse.web.dto.ApiResponse;
import com.chicu.marketpulse.web.dto.CreateAlertRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/alerts")
public class AlertApiController {

    private final AlertService alertService;

    @GetMapping
    public List<PriceAlert> list(@RequestParam(required = false) String owner) {
        return alertService.listActive(owner);
    }

    @PostMapping
    public ResponseEntity<PriceAlert> create(@RequestBody CreateAlertRequest req) {
        PriceAlert created = alertService.create(
                req.getOwner(),
                req.getSymbol(),
                req.getKind(),
                req.getThreshold()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/{id}")
    public ApiResponse delete(@PathVariable long id) {
        alertService.delete(id);
        return ApiResponse.ok("Alert " + id + " deactivated");
    }
}
