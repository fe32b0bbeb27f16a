package com.github.musiKk.haumea;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/**
 * Compiles every {@code .hau} file under {@code compiler-tests} and compares the compiled program,
 * without prologue and epilogue, to the {@code .c} file of the same name.
 */
public class CompilerGoldenTest {

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/compiler-tests";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".hau"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Compiler tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("compile " + testName, () -> {
            var source = Files.readString(testFile.toPath());
            var expected = Files.readString(testFile.toPath().resolveSibling(testName + ".c"));

            var compiled = CompilerTest.compiledProgram(new Compiler().compile(source));

            assertEquals(expected, compiled);
        });
    }

}
