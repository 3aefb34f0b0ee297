package com.governance.engine.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafePathsTest {

    @TempDir
    Path root;

    @Test
    void resolvesExistingDirectory() {
        assertThat(SafePaths.projectRoot(root.toString())).isEqualTo(root.toAbsolutePath().normalize());
    }

    @Test
    void rejectsBlankAndMissingRoots() {
        assertThatThrownBy(() -> SafePaths.projectRoot(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SafePaths.projectRoot(root.resolve("missing").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void rejectsTraversalOutsideRoot() {
        assertThat(SafePaths.within(root, "sds/../README.md")).isEqualTo(root.toAbsolutePath().normalize().resolve("README.md"));
        assertThatThrownBy(() -> SafePaths.within(root, "../outside.md"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Path traversal");
    }

    @Test
    void relativizeUsesForwardSlashes() {
        assertThat(SafePaths.relativize(root, root.resolve("sds").resolve("SBEP-INDEX.yaml")))
                .isEqualTo("sds/SBEP-INDEX.yaml");
    }
}
