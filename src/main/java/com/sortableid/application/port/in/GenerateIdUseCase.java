package com.sortableid.application.port.in;

import com.sortableid.domain.error.GenerationError;
import com.sortableid.domain.model.Result;

import java.util.List;

public interface GenerateIdUseCase {
    Result<String, GenerationError> generate();

    Result<List<String>, GenerationError> generateBatch(int count);
}
