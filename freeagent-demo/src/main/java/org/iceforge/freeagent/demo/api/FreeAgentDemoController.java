package org.iceforge.freeagent.demo.api;

import org.iceforge.freeagent.client.FreeAgentApiException;
import org.iceforge.freeagent.client.FreeAgentClient;
import org.iceforge.freeagent.client.FreeAgentModels;
import org.iceforge.freeagent.client.resources.TimeslipQuery;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read-only passthrough to a few FreeAgent resources, served through the cache. */
@RestController
@RequestMapping("/api/freeagent")
public class FreeAgentDemoController {

    private final FreeAgentClient client;

    public FreeAgentDemoController(FreeAgentClient client) {
        this.client = client;
    }

    @GetMapping("/me")
    public FreeAgentModels.User me() {
        return client.users().getMe();
    }

    @GetMapping("/contacts")
    public List<FreeAgentModels.Contact> contacts(@RequestParam(value = "view", required = false) String view) {
        return client.contacts().getAll(view);
    }

    @GetMapping("/contacts/{id}")
    public FreeAgentModels.Contact contact(@PathVariable("id") String id) {
        return client.contacts().getById(id);
    }

    @GetMapping("/invoices")
    public List<FreeAgentModels.Invoice> invoices(@RequestParam(value = "view", required = false) String view) {
        return client.invoices().getAll(view, null, null, null, null);
    }

    @GetMapping("/timeslips")
    public List<FreeAgentModels.Timeslip> timeslips(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return client.timeslips().getAll(TimeslipQuery.all().between(from, to));
    }

    @ExceptionHandler(FreeAgentApiException.class)
    public ResponseEntity<Map<String, Object>> upstreamFailure(FreeAgentApiException e) {
        HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("upstreamStatus", e.status());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
