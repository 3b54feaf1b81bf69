package org.datayoinker.controllers;

import jakarta.servlet.RequestDispatcher;
import org.datayoinker.models.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class CustomErrorControllerTest {

    private final CustomErrorController controller = new CustomErrorController();

    @Test
    void unknownRouteRendersNotFoundBody() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/error");
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 404);
        request.setAttribute(RequestDispatcher.ERROR_REQUEST_URI, "/publish/yoink/for/");

        ResponseEntity<ErrorResponse> response = controller.handleError(request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals(404, response.getBody().status());
        assertEquals("Not Found", response.getBody().detail());
        assertEquals("Not Found: /publish/yoink/for/", response.getBody().error());
    }

    @Test
    void uncaughtExceptionMessageBecomesCause() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/error");
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 500);
        request.setAttribute(RequestDispatcher.ERROR_EXCEPTION, new IllegalStateException("boom"));

        ResponseEntity<ErrorResponse> response = controller.handleError(request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(new ErrorResponse("boom", "Internal Server Error", 500), response.getBody());
    }

    @Test
    void missingStatusDefaultsToServerError() {
        ResponseEntity<ErrorResponse> response = controller.handleError(new MockHttpServletRequest());

        assertEquals(500, response.getStatusCode().value());
    }
}
