package org.minicc.node.integration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.awaitility.Awaitility;
import org.minicc.junit.extensions.logging.ExpectLog;
import org.minicc.junit.extensions.logging.LogLevel;
import org.minicc.junit.extensions.logging.LogWatchExtension;
import org.minicc.node.Node;
import org.minicc.node.processes.http.HttpServerProcess;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

/**
 * Runs the default node configuration on a free port and exercises the analysis API
 * and the browser UI over HTTP.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class NodeIntegrationTest {

    private static Node node;

    @BeforeAll
    static void startNode() {
        Config config = ConfigFactory.parseString("""
                node.processes.httpServer.options.network.port = 0
                node.processes.httpServer.options.routes."$controller".options.maxSourceLength = 200
                """)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
        node = new Node(config);
        node.start();

        RestAssured.port = ((HttpServerProcess) node.getProcess("httpServer")).getPort();
        RestAssured.baseURI = "http://127.0.0.1";

        Awaitility.await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
            given().when().get("/").then().statusCode(200));
    }

    @AfterAll
    static void stopNode() {
        if (node != null) {
            node.stop();
        }
        RestAssured.reset();
    }

    @Test
    void analyze_shouldReturnTokensErrorsAndCode() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"int x = 2 + 3 * 4;\\nint x;\\ny = 1;\"}")
        .when()
            .post("/analyze")
        .then()
            .statusCode(200)
            .contentType(ContentType.JSON)
            .body("tokens[0].type", is("KEYWORD"))
            .body("tokens[0].value", is("int"))
            .body("tokens", hasSize(16))
            .body("syntaxErrors", contains("Invalid declaration", "Invalid declaration", "Invalid declaration"))
            .body("semanticErrors", contains("'x' redeclared"))
            .body("intermediateCode", contains("int x", "t1 = 3 * 4", "t2 = 2 + t1", "x = t2", "int x"));
    }

    @Test
    void analyze_shouldReportLexicalErrorWith200() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"int x = 5 @ 3;\"}")
        .when()
            .post("/analyze")
        .then()
            .statusCode(200)
            .body("error", is("Unexpected character: @"));
    }

    @Test
    void analyze_withEmptyBody_shouldAnalyzeEmptySource() {
        given()
        .when()
            .post("/analyze")
        .then()
            .statusCode(200)
            .body("tokens", empty())
            .body("intermediateCode", empty());
    }

    @Test
    void analyze_shouldNormalizeWindowsLineEndings() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"int x;\\r\\nint y;\"}")
        .when()
            .post("/analyze")
        .then()
            .statusCode(200)
            .body("tokens", hasSize(6))
            .body("syntaxErrors", empty());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Bad request /analyze: Request body is not valid JSON.*")
    void analyze_withMalformedJson_shouldReturn400() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": ")
        .when()
            .post("/analyze")
        .then()
            .statusCode(400)
            .body("error", is("Bad Request"))
            .body("message", containsString("not valid JSON"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Rejected request /analyze: Source has 210 characters, the maximum is 200.")
    void analyze_withOversizedSource_shouldReturn413() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"code\": \"" + "x".repeat(210) + "\"}")
        .when()
            .post("/analyze")
        .then()
            .statusCode(413)
            .body("status", is(413))
            .body("message", is("Source has 210 characters, the maximum is 200."));
    }

    @Test
    void root_shouldServeBrowserUi() {
        given()
        .when()
            .get("/")
        .then()
            .statusCode(200)
            .contentType(containsString("text/html"))
            .body(containsString("analyzeButton"));
    }
}
