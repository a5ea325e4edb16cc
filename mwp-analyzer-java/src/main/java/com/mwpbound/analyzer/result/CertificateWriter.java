package com.mwpbound.analyzer.result;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;

/**
 * Serializes a certificate as pretty-printed JSON.
 */
public class CertificateWriter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static class CertificateWriteException extends RuntimeException {
        public CertificateWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code path}, creating parent directories if absent.
     */
    public void write(CertificateModel.CertRoot root, Path path) {
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CertificateWriteException("Could not create output directory: " + parent, e);
        }
        try (Writer w = Files.newBufferedWriter(path)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new CertificateWriteException("Failed to write certificate: " + e.getMessage(), e);
        }
        System.err.println("[mwp-analyzer] certificate written: " + path);
    }

    public String toJson(CertificateModel.CertRoot root) {
        return GSON.toJson(root);
    }
}
