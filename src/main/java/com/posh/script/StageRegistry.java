package com.posh.script;

import java.util.Optional;

import com.posh.script.PoshScript.Stage;

/** Lookup of built-in commands by name. Implementations match names case-insensitively. */
@FunctionalInterface
public interface StageRegistry {
    Optional<Stage> resolve(String name);

    StageRegistry EMPTY = name -> Optional.empty();
}
