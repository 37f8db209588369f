package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.model.DashboardPreference;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.DashboardPreferenceService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/me/dashboard-preferences")
public class DashboardPreferenceController {

    private final DashboardPreferenceService preferenceService;
    private final CurrentActorResolver actorResolver;

    public DashboardPreferenceController(DashboardPreferenceService preferenceService,
            CurrentActorResolver actorResolver) {
        this.preferenceService = preferenceService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public DashboardPreference get() {
        return preferenceService.getOrCreate(actorResolver.currentActor());
    }

    @PutMapping("/order")
    public DashboardPreference reorder(@RequestBody List<String> order) {
        return preferenceService.updateWidgetOrder(actorResolver.currentActor(), order);
    }

    @PostMapping("/widgets/{widget}/toggle")
    public DashboardPreference toggle(@PathVariable String widget) {
        return preferenceService.toggleWidgetVisibility(actorResolver.currentActor(), widget);
    }

    @PutMapping("/default-period")
    public DashboardPreference defaultPeriod(@RequestBody Map<String, String> body) {
        return preferenceService.updateDefaultPeriod(actorResolver.currentActor(), body.get("period"));
    }

    @PostMapping("/reset")
    public DashboardPreference reset() {
        return preferenceService.resetLayout(actorResolver.currentActor());
    }
}
