package com.initialone.jdocgap.vcs;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** Hands modified files to version control and returns the URL of the resulting change request. */
public interface ChangePublisher {

    /** Empty when nothing was published; implementations report failures themselves instead of throwing. */
    Optional<String> createDocumentationChange(List<Path> filesModified, int symbolCount);
}
