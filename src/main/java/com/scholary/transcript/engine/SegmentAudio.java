package com.scholary.transcript.engine;

import com.scholary.transcript.segment.Segment;
import java.nio.file.Path;

/** The audio of one segment, cut to its own file. */
public record SegmentAudio(Segment segment, Path file) {}
