package com.sortableid.adapter.in.web;

import com.sortableid.application.port.in.DecodeIdUseCase;
import com.sortableid.application.port.in.DescribeGeneratorUseCase;
import com.sortableid.application.port.in.GenerateIdUseCase;
import com.sortableid.application.service.SortableIdService;
import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.error.GenerationError;
import com.sortableid.domain.model.DecodedId;
import com.sortableid.domain.model.GeneratorInfo;
import com.sortableid.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "IDs", description = "Sortable ID issuance and decoding")
public class IdController {

    private final GenerateIdUseCase generateIdUseCase;
    private final DecodeIdUseCase decodeIdUseCase;
    private final DescribeGeneratorUseCase describeGeneratorUseCase;

    public IdController(
            GenerateIdUseCase generateIdUseCase,
            DecodeIdUseCase decodeIdUseCase,
            DescribeGeneratorUseCase describeGeneratorUseCase) {
        this.generateIdUseCase = generateIdUseCase;
        this.decodeIdUseCase = decodeIdUseCase;
        this.describeGeneratorUseCase = describeGeneratorUseCase;
    }

    @PostMapping("/ids")
    @Operation(summary = "Generate IDs", description = "Issues one or more IDs in strictly increasing order")
    public ResponseEntity<?> generate(
            @Parameter(description = "Number of IDs to issue (1-" + SortableIdService.MAX_BATCH_SIZE + ")")
            @RequestParam(required = false) Integer count) {

        int effectiveCount = count != null ? count : 1;
        if (effectiveCount < 1 || effectiveCount > SortableIdService.MAX_BATCH_SIZE) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR",
                "count must be between 1 and " + SortableIdService.MAX_BATCH_SIZE,
                RequestContext.getRequestId()));
        }

        if (effectiveCount == 1) {
            return generateIdUseCase.generate().<ResponseEntity<?>>fold(
                id -> ResponseEntity.status(HttpStatus.CREATED).body(new GenerateResponse(List.of(id))),
                this::toGenerationErrorResponse);
        }
        return generateIdUseCase.generateBatch(effectiveCount).<ResponseEntity<?>>fold(
            ids -> ResponseEntity.status(HttpStatus.CREATED).body(new GenerateResponse(ids)),
            this::toGenerationErrorResponse);
    }

    @GetMapping("/ids/{id}")
    @Operation(summary = "Decode an ID", description = "Recovers the issuance instant and the chrono and suffix fields")
    public ResponseEntity<?> decode(
            @Parameter(description = "Previously issued ID")
            @PathVariable String id) {
        return decodeIdUseCase.decode(id).<ResponseEntity<?>>fold(
            decoded -> ResponseEntity.ok(DecodeResponse.from(decoded)),
            this::toDecodeErrorResponse);
    }

    @GetMapping("/generator")
    @Operation(summary = "Describe the generator", description = "Returns field widths, alphabet, rate and supported dates")
    public ResponseEntity<GeneratorInfo> describe() {
        return ResponseEntity.ok(describeGeneratorUseCase.describe());
    }

    private ResponseEntity<ErrorResponse> toGenerationErrorResponse(GenerationError error) {
        HttpStatus status = error instanceof GenerationError.RateExceeded
            ? HttpStatus.TOO_MANY_REQUESTS
            : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private ResponseEntity<ErrorResponse> toDecodeErrorResponse(DecodeError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record GenerateResponse(List<String> ids) {}

    public record ErrorResponse(String error, String message, String requestId) {}

    public record DecodeResponse(
        Instant timestamp,
        long bucket,
        String timestampPart,
        String chronoPart,
        String suffixPart
    ) {
        public static DecodeResponse from(DecodedId decoded) {
            return new DecodeResponse(
                decoded.instant(),
                decoded.bucket(),
                decoded.timestampPart(),
                decoded.chronoPart(),
                decoded.suffixPart());
        }
    }
}
