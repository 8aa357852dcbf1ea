package uz.greenwhite.oauth2client.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.model.AuthRequest;
import uz.greenwhite.oauth2client.service.OAuth2ClientService;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OAuth2EndpointControllerTest {

    @Mock
    private OAuth2ClientService oAuth2ClientService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OAuth2EndpointController(oAuth2ClientService)).build();
    }

    @Test
    void returnsAuthorizationRequest() throws Exception {
        when(oAuth2ClientService.authorize("google", "bazqux")).thenReturn(new AuthRequest(
                "http://localhost:18080/auth?client_id=foo&response_type=code&state=bazqux",
                List.of("foo", "bar"),
                "bazqux"));

        mockMvc.perform(get("/api/v1/oauth2/google/authorization").param("state", "bazqux"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uri").value("http://localhost:18080/auth?client_id=foo&response_type=code&state=bazqux"))
                .andExpect(jsonPath("$.scope[1]").value("bar"))
                .andExpect(jsonPath("$.state").value("bazqux"));
    }

    @Test
    void unknownEndpointIsBadRequest() throws Exception {
        when(oAuth2ClientService.authorize("nope", null))
                .thenThrow(new OAuth2ConfigurationException("OAuth2 endpoint not configured: nope"));

        mockMvc.perform(get("/api/v1/oauth2/nope/authorization"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("configuration_error"))
                .andExpect(jsonPath("$.message").value("OAuth2 endpoint not configured: nope"));
    }

    @Test
    void describesConfiguredEndpoints() throws Exception {
        when(oAuth2ClientService.getInformation()).thenReturn(Map.of(
                "endpoints", Map.of("google", Map.of("grantType", "authorization_code")),
                "grantTypes", List.of("authorization_code", "password")));

        mockMvc.perform(get("/api/v1/oauth2/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.google.grantType").value("authorization_code"))
                .andExpect(jsonPath("$.grantTypes.length()").value(2));
    }
}
