package com.phillippitts.streamasr.presentation.controller;

import com.phillippitts.streamasr.domain.RecognitionResult;
import com.phillippitts.streamasr.exception.InvalidAudioException;
import com.phillippitts.streamasr.service.session.StreamingRecognizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Recognizes a recording of base64-encoded Opus packets.
 *
 * <p>A failed session is rethrown as its cause so
 * {@link com.phillippitts.streamasr.presentation.exception.GlobalExceptionHandler} picks the status.
 */
@RestController
@RequestMapping("/api/recognitions")
class RecognitionController {

    private static final Logger LOG = LogManager.getLogger(RecognitionController.class);

    private final StreamingRecognizer recognizer;

    RecognitionController(StreamingRecognizer recognizer) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
    }

    @PostMapping
    ResponseEntity<RecognitionResponse> recognize(@Valid @RequestBody RecognitionRequest request) {
        List<byte[]> packets = decodePackets(request.packets());
        LOG.info("Recognition requested: packets={}", packets.size());
        RecognitionResult result = recognizer.recognize(packets);
        if (result.failure().isPresent()) {
            throw result.failure().get().error();
        }
        return ResponseEntity.ok(RecognitionResponse.from(result));
    }

    private static List<byte[]> decodePackets(List<String> encoded) {
        Base64.Decoder decoder = Base64.getDecoder();
        List<byte[]> packets = new ArrayList<>(encoded.size());
        for (int i = 0; i < encoded.size(); i++) {
            try {
                packets.add(decoder.decode(encoded.get(i)));
            } catch (IllegalArgumentException e) {
                throw new InvalidAudioException(encoded.get(i).length(),
                        "Packet " + i + " is not valid base64");
            }
        }
        return packets;
    }
}
