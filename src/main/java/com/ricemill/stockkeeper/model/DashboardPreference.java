package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "dashboard_preferences")
@Data
public class DashboardPreference {
    public static final String DEFAULT_PERIOD = "this_month";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, updatable = false)
    private Long userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "dashboard_widget_order", joinColumns = @JoinColumn(name = "preference_id"))
    @OrderColumn(name = "position")
    @Column(name = "widget", nullable = false)
    private List<String> widgetOrder = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "dashboard_hidden_widgets", joinColumns = @JoinColumn(name = "preference_id"))
    @Column(name = "widget", nullable = false)
    private Set<String> hiddenWidgets = new LinkedHashSet<>();

    @Column(nullable = false)
    private String defaultPeriod = DEFAULT_PERIOD;

    @Version
    private Long version;
}
