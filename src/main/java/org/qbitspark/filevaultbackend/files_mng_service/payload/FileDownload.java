package org.qbitspark.filevaultbackend.files_mng_service.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

@Getter
@Builder
@AllArgsConstructor
public class FileDownload {
    private final UUID fileId;
    private final String fileName;
    private final String mimeType;
    private final long size;
    private final String checksum;
    private final byte[] content;
}
