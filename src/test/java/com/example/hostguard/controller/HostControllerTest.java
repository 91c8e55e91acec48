package com.example.hostguard.controller;

import com.example.hostguard.registry.Host;
import com.example.hostguard.registry.HostFilter;
import com.example.hostguard.registry.HostRegistry;
import com.example.hostguard.registry.HostSource;
import com.example.hostguard.registry.HostSuggestion;
import com.example.hostguard.registry.HostValidationResult;
import com.example.hostguard.service.HostIntelligenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HostControllerTest {

    @Mock
    private HostIntelligenceService intelligenceService;

    @Mock
    private HostRegistry registry;

    private HostController controller;

    @BeforeEach
    void setUp() {
        controller = new HostController(intelligenceService, registry);
    }

    @Test
    void unknownHostIsNotFoundWithSuggestions() {
        when(intelligenceService.validateTarget("web-0")).thenReturn(HostValidationResult.invalid("web-0",
                List.of(new HostSuggestion("web-01", 0.91)), "Host 'web-0' not found in inventory"));

        ResponseEntity<Map<String, Object>> response = controller.validate("web-0");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertEquals(false, body.get("valid"));
        assertEquals(List.of(new HostSuggestion("web-01", 0.91)), body.get("suggestions"));
        assertTrue(((String) body.get("message")).contains("web-01 (91% match)"));
    }

    @Test
    void knownHostIsOk() {
        Host host = Host.builder().hostname("web-01").build();
        when(intelligenceService.validateTarget("www")).thenReturn(HostValidationResult.valid(host, "www"));

        ResponseEntity<Map<String, Object>> response = controller.validate("www");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(host, response.getBody().get("host"));
    }

    @Test
    void listParsesSourceIntoTheFilter() {
        when(intelligenceService.searchHosts(any())).thenReturn(List.of());

        ResponseEntity<?> response = controller.listHosts("production", null, "ETC_HOSTS", null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ArgumentCaptor<HostFilter> filter = ArgumentCaptor.forClass(HostFilter.class);
        verify(intelligenceService).searchHosts(filter.capture());
        assertEquals(HostSource.ETC_HOSTS, filter.getValue().getSource());
        assertEquals("production", filter.getValue().getEnvironment());
    }

    @Test
    void unknownSourceIsBadRequest() {
        ResponseEntity<?> response = controller.listHosts(null, null, "ldap", null);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(intelligenceService);
    }

    @Test
    void invalidPatternIsBadRequest() {
        when(intelligenceService.searchHosts(any())).thenThrow(new PatternSyntaxException("Unclosed group", "(web", 4));

        ResponseEntity<?> response = controller.listHosts(null, null, null, "(web");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void manualRegistrationRequiresHostname() {
        ResponseEntity<?> response = controller.registerManual(Map.of("ip_address", "10.0.0.1"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(intelligenceService);
    }

    @Test
    void manualRegistrationPassesFieldsThrough() {
        Host host = Host.builder().hostname("new-box").source(HostSource.MANUAL).build();
        when(intelligenceService.registerManualHost("new-box", "10.0.0.9", "staging")).thenReturn(host);

        ResponseEntity<?> response = controller.registerManual(
                Map.of("hostname", "new-box", "ip_address", "10.0.0.9", "environment", "staging"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(host, response.getBody());
    }
}
