package org.datayoinker.controllers;

import lombok.RequiredArgsConstructor;
import org.datayoinker.models.dto.Yoink;
import org.datayoinker.service.ingestion.IngestionService;
import org.datayoinker.service.retrieval.RetrievalService;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class YoinkController {

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;

    /**
     * Accepts parameters from the query string and from a form-encoded body.
     */
    @PostMapping("/yoink/{topic}")
    public ResponseEntity<Yoink> publish(@PathVariable String topic,
                                         @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(ingestionService.publish(topic, params));
    }

    @GetMapping("/yoink/{topic}")
    public ResponseEntity<Yoink> latest(@PathVariable String topic) {
        return ResponseEntity.ok(retrievalService.getLatest(topic));
    }

    @GetMapping("/yoinks/{topic}/{number}")
    public ResponseEntity<List<Yoink>> lastNumber(@PathVariable String topic, @PathVariable String number) {
        return ResponseEntity.ok(retrievalService.getLastN(topic, number));
    }

    @GetMapping("/yoinks/{topic}")
    public ResponseEntity<List<Yoink>> all(@PathVariable String topic) {
        return ResponseEntity.ok(retrievalService.getAll(topic));
    }
}
