package org.pragmatica.refactor;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import org.pragmatica.refactor.text.Lines;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of refactoring one file: its original and its transformed text.
 */
public record Change(FileInfo fileInfo, String originalSource, String refactoredSource) {
    private static final int CONTEXT_LINES = 3;

    public Change {
        if (fileInfo.path() == null) {
            throw new IllegalArgumentException("Can't apply a change to a string");
        }
    }

    public Path file() {
        return fileInfo.file().orElseThrow();
    }

    /**
     * Unified diff from the original to the refactored text, empty when they are equal.
     */
    public String computeDiff() {
        var original = lines(originalSource);
        var refactored = lines(refactoredSource);
        var name = file().toString();
        var patch = DiffUtils.diff(original, refactored);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        var diff = UnifiedDiffUtils.generateUnifiedDiff(name, name, original, patch, CONTEXT_LINES);
        var sb = new StringBuilder();
        for (var line : diff) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * Write the refactored text to the file, in the file's encoding.
     */
    public void applyDiff() throws IOException {
        fileInfo.write(refactoredSource);
    }

    private static List<String> lines(String text) {
        var result = new ArrayList<String>();
        for (var line : Lines.split(text).asList()) {
            result.add(Lines.stripTerminator(line));
        }
        return result;
    }
}
