package org.devolia.clientregistry.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.devolia.clientregistry.model.ClientView;
import org.devolia.clientregistry.model.RegisterClientRequest;
import org.devolia.clientregistry.service.ClientRegistryService;
import org.devolia.clientregistry.service.RegistrationResult;
import org.devolia.clientregistry.service.error.PersistenceException;
import org.devolia.clientregistry.service.error.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operation boundary of the registry, for an HTTP, CLI or RPC front end to call.
 *
 * <p>Every failure is caught here, logged with the operation and key, and translated:
 *
 * <pre>
 * register      201 {success, token}   400 missing fields, 409 duplicate, 500 persistence
 * list          200 [{cnpj, nome}]     500 persistence
 * get           200 {cnpj, nome}       400 missing cnpj, 404 not found, 500 persistence
 * delete        200 {success, cnpj}    400 missing cnpj, 404 not found, 500 persistence
 * authenticate  200 {nome}             400 missing token, 401 unknown secret
 * </pre>
 *
 * <p>Store details never reach the caller; they are only logged.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientRegistryEndpoint {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistryEndpoint.class);

  private final ClientRegistryService service;
  private final ObjectMapper objectMapper;

  public ClientRegistryEndpoint(ClientRegistryService service) {
    this(service, new ObjectMapper());
  }

  public ClientRegistryEndpoint(ClientRegistryService service, ObjectMapper objectMapper) {
    this.service = Objects.requireNonNull(service, "service cannot be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
  }

  /**
   * Registers a client.
   *
   * @param request the registration input
   * @return 201 with the one-time token, or an error response
   */
  public ApiResponse register(RegisterClientRequest request) {
    String cnpj = request != null ? request.getCnpj() : null;
    try {
      RegistrationResult result = service.register(request);
      return ApiResponse.success(201, "token", result.getToken());
    } catch (RuntimeException e) {
      return failure(ClientRegistryService.OPERATION_REGISTER, cnpj, e);
    }
  }

  /**
   * Registers a client from a JSON body such as {@code {"cnpj": "...", "nome": "..."}}.
   *
   * @param json the request body
   * @return 201 with the one-time token, or an error response
   */
  public ApiResponse register(String json) {
    RegisterClientRequest request;
    try {
      request =
          json == null || json.isBlank()
              ? null
              : objectMapper.readValue(json, RegisterClientRequest.class);
    } catch (JsonProcessingException e) {
      logger.warn(
          "[{}] Malformed request body: {}",
          ClientRegistryService.OPERATION_REGISTER,
          e.getOriginalMessage());
      return ApiResponse.error(400, "Malformed request body");
    }
    return register(request);
  }

  /**
   * Lists all clients ordered by name.
   *
   * @return 200 with the client list, or an error response
   */
  public ApiResponse listAll() {
    try {
      List<ClientView> clients = service.listAll();
      return new ApiResponse(200, clients);
    } catch (RuntimeException e) {
      return failure(ClientRegistryService.OPERATION_LIST, null, e);
    }
  }

  /**
   * Retrieves a client by CNPJ.
   *
   * @param cnpj the CNPJ path parameter
   * @return 200 with the client, or an error response
   */
  public ApiResponse getByCnpj(String cnpj) {
    try {
      return new ApiResponse(200, service.getByCnpj(cnpj));
    } catch (RuntimeException e) {
      return failure(ClientRegistryService.OPERATION_GET, cnpj, e);
    }
  }

  /**
   * Deletes a client by CNPJ.
   *
   * @param cnpj the CNPJ path parameter
   * @return 200 with the deleted CNPJ, or an error response
   */
  public ApiResponse delete(String cnpj) {
    try {
      return ApiResponse.success(200, "cnpj", service.delete(cnpj));
    } catch (RuntimeException e) {
      return failure(ClientRegistryService.OPERATION_DELETE, cnpj, e);
    }
  }

  /**
   * Resolves a presented secret to its client name.
   *
   * @param token the presented secret
   * @return 200 with the client name, 401 if unknown, or an error response
   */
  public ApiResponse authenticate(String token) {
    try {
      Optional<String> nome = service.authenticate(token);
      if (nome.isEmpty()) {
        logger.warn(
            "[{}] Rejected unknown client secret", ClientRegistryService.OPERATION_AUTHENTICATE);
        return ApiResponse.error(401, "Invalid client secret");
      }
      return new ApiResponse(200, Collections.singletonMap("nome", nome.get()));
    } catch (RuntimeException e) {
      return failure(ClientRegistryService.OPERATION_AUTHENTICATE, null, e);
    }
  }

  /**
   * Serializes a response body to JSON.
   *
   * @param response the response
   * @return the JSON body
   * @throws IllegalStateException if the body cannot be serialized
   */
  public String toJson(ApiResponse response) {
    try {
      return objectMapper.writeValueAsString(response.getBody());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize response body", e);
    }
  }

  private ApiResponse failure(String operation, String key, RuntimeException e) {
    if (e instanceof PersistenceException persistence) {
      logger.error(
          "[{}] Store failure for key {} (category: {})",
          operation,
          key,
          persistence.getErrorCategory(),
          e);
      return ApiResponse.error(persistence.getStatus(), persistence.getMessage());
    }

    if (e instanceof RegistryException registry) {
      logger.warn("[{}] Rejected request for key {}: {}", operation, key, registry.getMessage());
      return ApiResponse.error(registry.getStatus(), registry.getMessage());
    }

    logger.error("[{}] Unexpected failure for key {}", operation, key, e);
    return ApiResponse.error(500, "Internal error");
  }
}
