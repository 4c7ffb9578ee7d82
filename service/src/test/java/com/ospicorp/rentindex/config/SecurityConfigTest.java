package com.ospicorp.rentindex.config;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.rentindex.ApiTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@AutoConfigureMockMvc
@TestPropertySource(properties = "security.auth.enabled=true")
class SecurityConfigTest extends ApiTestSupport {

  private static final String BATCH_BODY = "{\"geo\":\"zip\",\"regions\":[\"75001\"],"
      + "\"mode\":\"residual\",\"run_forecast\":false}";

  @MockBean
  private JwtDecoder jwtDecoder;

  @Autowired
  private MockMvc mvc;

  @Test
  void pingStaysPublic() throws Exception {
    mvc.perform(get("/v1/ping")).andExpect(status().isOk());
  }

  @Test
  void readsNeedAToken() throws Exception {
    mvc.perform(get("/v1/regions")).andExpect(status().isUnauthorized());
    mvc.perform(get("/v1/regions").with(jwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.regions[0]").value("NY"));
  }

  @Test
  void batchNeedsTheBatchScope() throws Exception {
    mvc.perform(post("/v1/batch").with(jwt().authorities(new SimpleGrantedAuthority("SCOPE_read")))
            .contentType(MediaType.APPLICATION_JSON)
            .content(BATCH_BODY))
        .andExpect(status().isForbidden());

    mvc.perform(post("/v1/batch")
            .with(jwt().authorities(new SimpleGrantedAuthority("SCOPE_batch:run")))
            .contentType(MediaType.APPLICATION_JSON)
            .content(BATCH_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.succeeded").value(1));
  }
}
