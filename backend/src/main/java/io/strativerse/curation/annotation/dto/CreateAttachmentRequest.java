package io.strativerse.curation.annotation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAttachmentRequest(
    @NotBlank(message = "type is required") @Size(max = 55) String type,
    @NotBlank(message = "key is required") @Size(max = 55) String key,
    @NotBlank(message = "fileRef is required") @Size(max = 500) String fileRef,
    @Size(max = 255) String fileName,
    @Size(max = 500) String comment) {}
