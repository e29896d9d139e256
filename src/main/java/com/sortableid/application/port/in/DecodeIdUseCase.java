package com.sortableid.application.port.in;

import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.model.DecodedId;
import com.sortableid.domain.model.Result;

public interface DecodeIdUseCase {
    Result<DecodedId, DecodeError> decode(String id);
}
