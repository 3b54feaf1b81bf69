package org.datayoinker.controllers;

import lombok.RequiredArgsConstructor;
import org.datayoinker.models.dto.Yoink;
import org.datayoinker.service.ingestion.IngestionService;
import org.datayoinker.service.retrieval.RetrievalService;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Verb-phrase routes, e.g. {@code /publish/yoink/for/{topic}?temp=25.7}.
 * See <a href="https://github.com/jheising/HAPI">HAPI</a>.
 */
@RestController
@RequiredArgsConstructor
public class HapiController {

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;

    @GetMapping("/publish/yoink/for/{topic}")
    public ResponseEntity<Yoink> publish(@PathVariable String topic,
                                         @RequestParam MultiValueMap<String, String> params) {
        return ResponseEntity.ok(ingestionService.publish(topic, params));
    }

    @GetMapping("/get/latest/yoink/from/{topic}")
    public ResponseEntity<Yoink> latest(@PathVariable String topic) {
        return ResponseEntity.ok(retrievalService.getLatest(topic));
    }

    @GetMapping({
            "/get/last/{number}/yoinks/from/{topic}",
            "/get/{number}/last/yoinks/from/{topic}",
            "/get/latest/{number}/yoinks/from/{topic}",
            "/get/{number}/latest/yoinks/from/{topic}"
    })
    public ResponseEntity<List<Yoink>> lastNumber(@PathVariable String number, @PathVariable String topic) {
        return ResponseEntity.ok(retrievalService.getLastN(topic, number));
    }

    @GetMapping("/get/all/yoinks/from/{topic}")
    public ResponseEntity<List<Yoink>> all(@PathVariable String topic) {
        return ResponseEntity.ok(retrievalService.getAll(topic));
    }
}
