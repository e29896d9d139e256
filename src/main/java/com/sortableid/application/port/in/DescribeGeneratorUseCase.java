package com.sortableid.application.port.in;

import com.sortableid.domain.model.GeneratorInfo;

import java.time.Instant;

public interface DescribeGeneratorUseCase {
    GeneratorInfo describe();

    Instant maxSupportedInstant();
}
