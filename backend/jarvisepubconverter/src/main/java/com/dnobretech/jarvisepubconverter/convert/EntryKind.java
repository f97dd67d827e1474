package com.dnobretech.jarvisepubconverter.convert;

public enum EntryKind {
    DIRECTORY,
    TEXT_TARGET,
    BINARY_PASSTHROUGH
}
