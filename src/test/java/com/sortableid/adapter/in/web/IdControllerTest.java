package com.sortableid.adapter.in.web;

import com.sortableid.application.port.in.DecodeIdUseCase;
import com.sortableid.application.port.in.DescribeGeneratorUseCase;
import com.sortableid.application.port.in.GenerateIdUseCase;
import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.error.GenerationError;
import com.sortableid.domain.model.DecodedId;
import com.sortableid.domain.model.GeneratorConfig;
import com.sortableid.domain.model.GeneratorInfo;
import com.sortableid.domain.model.GeneratorSettings;
import com.sortableid.domain.model.Result;
import com.sortableid.domain.model.TimeGranularity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(IdController.class)
class IdControllerTest {

    private static final String ID = "-0zZ_aB1c2D3e4F5g6H7i8J9k-lLmMnN";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GenerateIdUseCase generateIdUseCase;

    @MockBean
    private DecodeIdUseCase decodeIdUseCase;

    @MockBean
    private DescribeGeneratorUseCase describeGeneratorUseCase;

    @Test
    void shouldGenerateSingleId() throws Exception {
        when(generateIdUseCase.generate()).thenReturn(Result.success(ID));

        mockMvc.perform(post("/api/v1/ids"))
            .andExpect(status().isCreated())
            .andExpect(header().exists("X-Request-Id"))
            .andExpect(jsonPath("$.ids[0]").value(ID))
            .andExpect(jsonPath("$.ids.length()").value(1));

        verify(generateIdUseCase, never()).generateBatch(anyInt());
    }

    @Test
    void shouldGenerateBatch() throws Exception {
        when(generateIdUseCase.generateBatch(3)).thenReturn(Result.success(List.of("a", "b", "c")));

        mockMvc.perform(post("/api/v1/ids").param("count", "3"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.ids[2]").value("c"));
    }

    @Test
    void shouldRejectCountOutOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/ids").param("count", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/v1/ids").param("count", "1001"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(generateIdUseCase);
    }

    @Test
    void shouldRejectNonNumericCount() throws Exception {
        mockMvc.perform(post("/api/v1/ids").param("count", "many"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldMapRateExceededToTooManyRequests() throws Exception {
        when(generateIdUseCase.generate())
            .thenReturn(Result.failure(new GenerationError.RateExceeded(TimeGranularity.MICROSECOND, 32)));

        mockMvc.perform(post("/api/v1/ids").header("X-Request-Id", "req-42"))
            .andExpect(status().isTooManyRequests())
            .andExpect(header().string("X-Request-Id", "req-42"))
            .andExpect(jsonPath("$.error").value("RATE_EXCEEDED"))
            .andExpect(jsonPath("$.requestId").value("req-42"));
    }

    @Test
    void shouldMapTimestampExhaustedToServiceUnavailable() throws Exception {
        when(generateIdUseCase.generateBatch(2)).thenReturn(Result.failure(
            new GenerationError.TimestampExhausted(1L << 40, Instant.parse("2030-01-01T00:00:00Z"))));

        mockMvc.perform(post("/api/v1/ids").param("count", "2"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("TIMESTAMP_EXHAUSTED"));
    }

    @Test
    void shouldMapInternalFailuresToServerError() throws Exception {
        when(generateIdUseCase.generate())
            .thenThrow(new IllegalArgumentException("Value 99 does not fit in 1 base-2 symbols"));

        mockMvc.perform(post("/api/v1/ids"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    void shouldDecodeId() throws Exception {
        DecodedId decoded = new DecodedId(
            Instant.parse("2024-02-20T12:00:00.123456Z"), 4_449_600_123_456L, ID.substring(0, 10), ID.substring(10, 12), ID.substring(12));
        when(decodeIdUseCase.decode(ID)).thenReturn(Result.success(decoded));

        mockMvc.perform(get("/api/v1/ids/{id}", ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.timestamp").value("2024-02-20T12:00:00.123456Z"))
            .andExpect(jsonPath("$.bucket").value(4_449_600_123_456L))
            .andExpect(jsonPath("$.chronoPart").value(ID.substring(10, 12)))
            .andExpect(jsonPath("$.suffixPart").value(ID.substring(12)));
    }

    @Test
    void shouldRejectMalformedId() throws Exception {
        when(decodeIdUseCase.decode("short")).thenReturn(Result.failure(new DecodeError.WrongLength(32, 5)));

        mockMvc.perform(get("/api/v1/ids/{id}", "short"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ID_WRONG_LENGTH"))
            .andExpect(jsonPath("$.requestId").exists());
    }

    @Test
    void shouldDescribeGenerator() throws Exception {
        GeneratorConfig config = GeneratorConfig.resolve(GeneratorSettings.defaults()).getOrThrow();
        when(describeGeneratorUseCase.describe()).thenReturn(GeneratorInfo.from(config, false));

        mockMvc.perform(get("/api/v1/generator"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.timestampLength").value(10))
            .andExpect(jsonPath("$.chronoLength").value(2))
            .andExpect(jsonPath("$.suffixLength").value(20))
            .andExpect(jsonPath("$.epochStart").value("2024-01-01T00:00:00Z"))
            .andExpect(jsonPath("$.insecureRandomFallbackUsed").value(false));
    }
}
