package com.includeslice.core.preprocessor;

public enum FileChangeReason {
    ENTER_FILE,
    EXIT_FILE
}
