package io.clientmock.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the core module stays independent of any mocking library. Mocking back ends
 * live in their own adapter modules.
 */
class CoreDependencyTest {

    /** Mocking library group IDs that must not appear on the core classpath. */
    private static final List<String> FORBIDDEN_GROUPS = List.of(
            "org.mockito", // Mockito
            "org.easymock", // EasyMock
            "io.mockk", // MockK
            "org.jmock" // jMock
            );

    @Test
    void coreClasspathContainsNoMockingLibrary() {
        String classpath = System.getProperty("java.class.path");
        assertThat(classpath).as("java.class.path should be set").isNotNull();

        for (String forbiddenGroup : FORBIDDEN_GROUPS) {
            String pathFragment = forbiddenGroup.replace('.', '/');
            assertThat(classpath)
                    .as("Core classpath must not contain mocking library: %s", forbiddenGroup)
                    .doesNotContain(pathFragment);
        }
    }
}
