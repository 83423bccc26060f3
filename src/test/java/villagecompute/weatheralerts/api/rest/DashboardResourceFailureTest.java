/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.types.DashboardAlertType;
import villagecompute.weatheralerts.services.DashboardService;

/**
 * Unit tests for {@link DashboardResource} paths that do not render a template.
 */
class DashboardResourceFailureTest {

    @Mock
    DashboardService dashboardService;

    @InjectMocks
    DashboardResource resource;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testDashboard_buildFailureIsBadGateway() {
        when(dashboardService.buildDashboard()).thenThrow(new IllegalStateException("routing misconfigured"));

        Response response = resource.dashboard();

        assertEquals(502, response.getStatus());
    }

    @Test
    void testRoot_redirect() {
        Response response = resource.root();

        assertEquals(302, response.getStatus());
        assertTrue(response.getLocation().toString().endsWith("/weatheralerts"));
    }

    @Test
    void testAlerts_delegatesToService() {
        Map<String, List<DashboardAlertType>> data = Map.of("Alamance County",
                List.of(new DashboardAlertType("Wind Advisory", "Wind Advisory: Gusty winds.")));
        when(dashboardService.buildDashboardByLabel()).thenReturn(data);

        assertEquals(data, resource.alerts());
    }
}
