package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.PeriodName;
import com.ricemill.stockkeeper.exception.InvalidPeriodException;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.DashboardPreference;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.repository.DashboardPreferenceRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Layout preferences of the acting user. There is no way to read or change
 * another user's preferences.
 */
@Service
@Transactional
public class DashboardPreferenceService {

    private final DashboardPreferenceRepository preferenceRepository;

    public DashboardPreferenceService(DashboardPreferenceRepository preferenceRepository) {
        this.preferenceRepository = preferenceRepository;
    }

    public DashboardPreference getOrCreate(User actor) {
        requireActor(actor);
        return preferenceRepository.findByUserId(actor.getId())
                .orElseGet(() -> preferenceRepository.save(defaults(actor.getId())));
    }

    /**
     * Replaces the order. Every widget must be known and listed once; widgets left
     * out keep their relative order at the end.
     */
    public DashboardPreference updateWidgetOrder(User actor, List<String> order) {
        if (order == null) {
            throw new IllegalArgumentException("Widget order is required");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String widget : order) {
            requireKnown(widget);
            if (!seen.add(widget)) {
                throw new IllegalArgumentException("Widget listed twice: " + widget);
            }
        }
        DashboardPreference preference = getOrCreate(actor);
        List<String> updated = new ArrayList<>(seen);
        for (String widget : preference.getWidgetOrder()) {
            if (!seen.contains(widget)) {
                updated.add(widget);
            }
        }
        preference.getWidgetOrder().clear();
        preference.getWidgetOrder().addAll(updated);
        return preferenceRepository.save(preference);
    }

    public DashboardPreference toggleWidgetVisibility(User actor, String widget) {
        requireKnown(widget);
        DashboardPreference preference = getOrCreate(actor);
        if (!preference.getHiddenWidgets().remove(widget)) {
            preference.getHiddenWidgets().add(widget);
        }
        return preferenceRepository.save(preference);
    }

    public DashboardPreference resetLayout(User actor) {
        DashboardPreference preference = getOrCreate(actor);
        preference.getWidgetOrder().clear();
        preference.getWidgetOrder().addAll(DashboardService.WIDGETS);
        preference.getHiddenWidgets().clear();
        preference.setDefaultPeriod(DashboardPreference.DEFAULT_PERIOD);
        return preferenceRepository.save(preference);
    }

    /**
     * Only named periods can be a default; a custom range has no meaning across days.
     */
    public DashboardPreference updateDefaultPeriod(User actor, String periodKey) {
        PeriodName name = PeriodName.fromKey(periodKey);
        if (name == PeriodName.CUSTOM) {
            throw new InvalidPeriodException("A custom period cannot be the default");
        }
        DashboardPreference preference = getOrCreate(actor);
        preference.setDefaultPeriod(name.key());
        return preferenceRepository.save(preference);
    }

    private static DashboardPreference defaults(Long userId) {
        DashboardPreference preference = new DashboardPreference();
        preference.setUserId(userId);
        preference.getWidgetOrder().addAll(DashboardService.WIDGETS);
        return preference;
    }

    private static void requireActor(User actor) {
        if (actor == null || actor.getId() == null) {
            throw new UnauthorizedException("No authenticated actor");
        }
    }

    private static void requireKnown(String widget) {
        if (widget == null || !DashboardService.WIDGETS.contains(widget)) {
            throw new IllegalArgumentException("Unknown widget: " + widget);
        }
    }
}
