package com.zzf.gazer.provider;

import com.zzf.gazer.model.ModelInfo;
import com.zzf.gazer.model.ModelParams;
import com.zzf.gazer.stream.ChunkStream;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class StreamingCompletion implements AutoCloseable {
    ChunkStream chunks;
    ModelInfo model;
    ModelParams params;

    @Override
    public void close() {
        chunks.close();
    }
}
