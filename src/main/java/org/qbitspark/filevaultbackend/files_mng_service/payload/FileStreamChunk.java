package org.qbitspark.filevaultbackend.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

@Getter
@Builder
@AllArgsConstructor
public class FileStreamChunk {
    private final UUID fileId;
    private final String mimeType;
    // Inclusive byte offsets
    private final long start;
    private final long end;
    private final long totalSize;
    private final byte[] content;

    public boolean isPartial() {
        return start > 0 || end < totalSize - 1;
    }

    public String contentRange() {
        return "bytes " + start + "-" + end + "/" + totalSize;
    }
}
