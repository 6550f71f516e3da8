package com.scholary.transcript.service;

/** A downloadable job output. */
public record JobOutput(String filename, String contentType, byte[] content) {}
