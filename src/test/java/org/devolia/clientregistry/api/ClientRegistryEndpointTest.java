package org.devolia.clientregistry.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.devolia.clientregistry.model.ClientView;
import org.devolia.clientregistry.model.RegisterClientRequest;
import org.devolia.clientregistry.service.ClientRegistryService;
import org.devolia.clientregistry.service.RegistrationResult;
import org.devolia.clientregistry.service.error.ConflictException;
import org.devolia.clientregistry.service.error.NotFoundException;
import org.devolia.clientregistry.service.error.PersistenceException;
import org.devolia.clientregistry.service.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ClientRegistryEndpoint status and body translation.
 *
 * @author Devolia
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ClientRegistryEndpointTest {

  @Mock private ClientRegistryService service;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ClientRegistryEndpoint endpoint;

  @BeforeEach
  void setUp() {
    endpoint = new ClientRegistryEndpoint(service, objectMapper);
  }

  @Test
  void testRegisterCreated() throws Exception {
    when(service.register(any())).thenReturn(new RegistrationResult("123", "tok"));

    ApiResponse response = endpoint.register(new RegisterClientRequest("123", "Acme"));

    assertEquals(201, response.getStatus());
    assertTrue(response.isSuccessful());
    JsonNode body = objectMapper.readTree(endpoint.toJson(response));
    assertTrue(body.get("success").asBoolean());
    assertEquals("tok", body.get("token").asText());
  }

  @Test
  void testRegisterFromJson() {
    when(service.register(any())).thenReturn(new RegistrationResult("123", "tok"));
    ArgumentCaptor<RegisterClientRequest> captor =
        ArgumentCaptor.forClass(RegisterClientRequest.class);

    ApiResponse response = endpoint.register("{\"cnpj\":\"123\",\"nome\":\"Acme\",\"x\":1}");

    assertEquals(201, response.getStatus());
    verify(service).register(captor.capture());
    assertEquals("123", captor.getValue().getCnpj());
    assertEquals("Acme", captor.getValue().getNome());
  }

  @Test
  void testRegisterMalformedJson() {
    ApiResponse response = endpoint.register("{not json");

    assertEquals(400, response.getStatus());
    assertEquals("{\"error\":\"Malformed request body\"}", endpoint.toJson(response));
    verifyNoInteractions(service);
  }

  @Test
  void testRegisterErrors() {
    when(service.register(any()))
        .thenThrow(new ValidationException(List.of("cnpj", "nome")))
        .thenThrow(new ConflictException("Client already exists"))
        .thenThrow(
            new PersistenceException(
                "Internal error registering client", "connection", new RuntimeException("pg")));

    ApiResponse validation = endpoint.register(new RegisterClientRequest(null, null));
    ApiResponse conflict = endpoint.register(new RegisterClientRequest("123", "Acme"));
    ApiResponse persistence = endpoint.register(new RegisterClientRequest("123", "Acme"));

    assertEquals(400, validation.getStatus());
    assertEquals(
        "{\"error\":\"Missing required fields: cnpj, nome\"}", endpoint.toJson(validation));
    assertEquals(409, conflict.getStatus());
    assertEquals("{\"error\":\"Client already exists\"}", endpoint.toJson(conflict));
    assertEquals(500, persistence.getStatus());
    assertEquals("{\"error\":\"Internal error registering client\"}", endpoint.toJson(persistence));
  }

  @Test
  void testListAll() {
    when(service.listAll()).thenReturn(List.of(new ClientView("1", "Alpha")));

    ApiResponse response = endpoint.listAll();

    assertEquals(200, response.getStatus());
    assertEquals("[{\"cnpj\":\"1\",\"nome\":\"Alpha\"}]", endpoint.toJson(response));
  }

  @Test
  void testListAllEmpty() {
    when(service.listAll()).thenReturn(List.of());

    assertEquals("[]", endpoint.toJson(endpoint.listAll()));
  }

  @Test
  void testGetByCnpj() {
    when(service.getByCnpj("1")).thenReturn(new ClientView("1", "Alpha"));
    when(service.getByCnpj("2")).thenThrow(new NotFoundException("Client not found"));

    ApiResponse found = endpoint.getByCnpj("1");
    ApiResponse missing = endpoint.getByCnpj("2");

    assertEquals(200, found.getStatus());
    assertEquals("{\"cnpj\":\"1\",\"nome\":\"Alpha\"}", endpoint.toJson(found));
    assertEquals(404, missing.getStatus());
    assertEquals("{\"error\":\"Client not found\"}", endpoint.toJson(missing));
  }

  @Test
  void testDelete() throws Exception {
    when(service.delete("1")).thenReturn("1");

    ApiResponse response = endpoint.delete("1");

    assertEquals(200, response.getStatus());
    JsonNode body = objectMapper.readTree(endpoint.toJson(response));
    assertTrue(body.get("success").asBoolean());
    assertEquals("1", body.get("cnpj").asText());
  }

  @Test
  void testDeleteHidesStoreDetails() {
    when(service.delete("1"))
        .thenThrow(
            new PersistenceException(
                "Error deleting client", "database", new RuntimeException("relation missing")));

    ApiResponse response = endpoint.delete("1");

    assertEquals(500, response.getStatus());
    assertFalse(endpoint.toJson(response).contains("relation"));
  }

  @Test
  void testAuthenticate() {
    when(service.authenticate("good")).thenReturn(Optional.of("Acme"));
    when(service.authenticate("bad")).thenReturn(Optional.empty());

    assertEquals("{\"nome\":\"Acme\"}", endpoint.toJson(endpoint.authenticate("good")));
    ApiResponse rejected = endpoint.authenticate("bad");
    assertEquals(401, rejected.getStatus());
    assertEquals("{\"error\":\"Invalid client secret\"}", endpoint.toJson(rejected));
  }

  @Test
  void testUnexpectedFailure() {
    when(service.listAll()).thenThrow(new IllegalStateException("bug"));

    ApiResponse response = endpoint.listAll();

    assertEquals(500, response.getStatus());
    assertEquals("{\"error\":\"Internal error\"}", endpoint.toJson(response));
  }
}
