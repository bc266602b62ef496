package com.example.musiclibrary.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LibraryDirectoryRequest {

    @NotBlank
    private String path;
}
