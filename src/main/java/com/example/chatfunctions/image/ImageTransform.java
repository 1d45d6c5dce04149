package com.example.chatfunctions.image;

import java.io.IOException;
import java.nio.file.Path;

public interface ImageTransform {

    /** Blurs the whole image stored at {@code file}, rewriting the file in place. */
    void blur(Path file) throws IOException;
}
