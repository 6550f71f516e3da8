package com.scholary.transcript.service;

/**
 * Settings a client sends with an upload.
 *
 * @param model model name, or {@code null} for the configured default
 * @param keepSourceLanguage transcribe in the spoken language instead of translating
 * @param skipSubtitle produce only the plain transcript
 * @param segmentLengthSeconds segment length, or {@code null} for the configured default
 */
public record JobSubmission(
    String model, boolean keepSourceLanguage, boolean skipSubtitle, Integer segmentLengthSeconds) {}
