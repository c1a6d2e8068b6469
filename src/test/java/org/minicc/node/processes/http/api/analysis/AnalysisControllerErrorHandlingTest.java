package org.minicc.node.processes.http.api.analysis;

import com.typesafe.config.ConfigFactory;
import io.javalin.Javalin;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.minicc.compiler.api.ICompiler;
import org.minicc.junit.extensions.logging.ExpectLog;
import org.minicc.junit.extensions.logging.LogLevel;
import org.minicc.junit.extensions.logging.LogWatchExtension;
import org.minicc.node.spi.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Verifies the HTTP error responses of {@link AnalysisController} on a bare Javalin app
 * with a compiler that fails unexpectedly.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class AnalysisControllerErrorHandlingTest {

    private Javalin app;

    @BeforeEach
    void setUp() {
        ICompiler failingCompiler = mock(ICompiler.class);
        when(failingCompiler.analyze(anyString())).thenThrow(new IllegalStateException("boom"));
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(ICompiler.class, failingCompiler);

        app = Javalin.create(config -> config.showJavalinBanner = false);
        new AnalysisController(registry, ConfigFactory.empty()).registerRoutes(app, "/api");
        app.start("127.0.0.1", 0);
        RestAssured.port = app.port();
        RestAssured.baseURI = "http://127.0.0.1";
    }

    @AfterEach
    void tearDown() {
        app.stop();
        RestAssured.reset();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*AnalysisController", messagePattern = "Unhandled exception for request /api/analyze")
    void unexpectedFailure_shouldReturn500WithoutDetails() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"int x;\"}")
        .when()
            .post("/api/analyze")
        .then()
            .statusCode(500)
            .contentType(ContentType.JSON)
            .body("status", is(500))
            .body("error", is("Internal Server Error"))
            .body("message", is("An internal server error occurred."))
            .body("timestamp", not(emptyOrNullString()));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*AnalysisController", messagePattern = "Bad request /api/analyze: .*")
    void malformedJson_shouldReturn400() {
        given()
            .contentType(ContentType.JSON)
            .body("{not json")
        .when()
            .post("/api/analyze")
        .then()
            .statusCode(400)
            .body("status", is(400))
            .body("error", is("Bad Request"));
    }
}
