package com.scholary.transcript.engine;

/** Whether the engine translates to English or keeps the spoken language. */
public enum LanguageMode {
  TRANSLATE("translate"),
  PRESERVE_SOURCE("transcribe");

  private final String whisperTask;

  LanguageMode(String whisperTask) {
    this.whisperTask = whisperTask;
  }

  /** The Whisper {@code task} parameter for this mode. */
  public String whisperTask() {
    return whisperTask;
  }

  public static LanguageMode of(boolean keepSourceLanguage) {
    return keepSourceLanguage ? PRESERVE_SOURCE : TRANSLATE;
  }
}
