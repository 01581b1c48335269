package warden.adapter.in.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.in.problem.AuthProblem;
import warden.adapter.in.problem.GlobalExceptionMappers;

@DisplayName("Request body validation")
class RequestValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static Set<String> invalidFields(Object request) {
        return validator.validate(request).stream()
                .map(violation -> violation.getPropertyPath().toString())
                .collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("LoginRequest")
    class LoginRequestTests {

        @Test
        @DisplayName("should accept email and password with optional device info")
        void shouldAcceptValidRequest() {
            assertTrue(invalidFields(new LoginRequest("alice@example.com", "secret", null)).isEmpty());
            assertTrue(invalidFields(new LoginRequest("alice@example.com", "", Map.of("os", "linux")))
                    .isEmpty());
        }

        @Test
        @DisplayName("should require a non-blank email")
        void shouldRequireEmail() {
            assertEquals(Set.of("email"), invalidFields(new LoginRequest(null, "secret", null)));
            assertEquals(Set.of("email"), invalidFields(new LoginRequest("   ", "secret", null)));
        }

        @Test
        @DisplayName("should reject a malformed email")
        void shouldRejectMalformedEmail() {
            assertEquals(Set.of("email"), invalidFields(new LoginRequest("not-an-email", "secret", null)));
        }

        @Test
        @DisplayName("should require a password")
        void shouldRequirePassword() {
            assertEquals(Set.of("password"), invalidFields(new LoginRequest("alice@example.com", null, null)));
        }
    }

    @Nested
    @DisplayName("RefreshRequest")
    class RefreshRequestTests {

        @Test
        @DisplayName("should accept a refresh token")
        void shouldAcceptToken() {
            assertTrue(invalidFields(new RefreshRequest("opaque-secret")).isEmpty());
        }

        @Test
        @DisplayName("should require a non-blank refresh token")
        void shouldRequireToken() {
            assertEquals(Set.of("refreshToken"), invalidFields(new RefreshRequest(null)));
            assertEquals(Set.of("refreshToken"), invalidFields(new RefreshRequest("")));
        }
    }

    @Test
    @DisplayName("violations should map to a 400 problem naming each field")
    void violationsShouldMapToBadRequest() {
        Set<ConstraintViolation<LoginRequest>> violations = validator.validate(new LoginRequest(null, null, null));

        var response = new GlobalExceptionMappers().mapConstraintViolation(new ConstraintViolationException(violations));

        assertEquals(400, response.getStatus());
        var problem = assertInstanceOf(HttpProblem.class, response.getEntity());
        assertEquals(AuthProblem.INVALID_REQUEST, problem.getParameters().get(AuthProblem.CODE));
        assertEquals(
                List.of("email: email is required", "password: password is required"),
                problem.getParameters().get(AuthProblem.VIOLATIONS));
    }
}
