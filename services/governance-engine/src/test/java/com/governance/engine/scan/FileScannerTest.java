package com.governance.engine.scan;

import com.governance.engine.support.ProjectFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileScannerTest {

    @TempDir
    Path root;

    @Test
    void listsDocumentationAndConfigFilesSorted() {
        ProjectFixture.write(root, "README.md", "# readme");
        ProjectFixture.write(root, "docs/guide.MD", "guide");
        ProjectFixture.write(root, "config/app.yml", "a: 1");
        ProjectFixture.write(root, "config/other.yaml", "b: 2");
        ProjectFixture.write(root, "package.json", "{}");
        ProjectFixture.write(root, "src/Main.java", "class Main {}");

        assertThat(new FileScanner().scan(root))
                .containsExactly("README.md", "config/app.yml", "config/other.yaml", "docs/guide.MD", "package.json");
    }

    @Test
    void skipsExcludedDirectories() {
        ProjectFixture.write(root, "node_modules/lib/README.md", "x");
        ProjectFixture.write(root, ".git/config.json", "{}");
        ProjectFixture.write(root, "target/report.json", "{}");
        ProjectFixture.write(root, ".tmp/scratch.md", "x");
        ProjectFixture.write(root, "docs/kept.md", "x");

        assertThat(new FileScanner().scan(root)).containsExactly("docs/kept.md");
    }

    @Test
    void emptyProjectYieldsNothing() {
        assertThat(new FileScanner().scan(root)).isEmpty();
    }
}
