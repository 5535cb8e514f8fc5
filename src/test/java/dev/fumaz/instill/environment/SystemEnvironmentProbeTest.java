package dev.fumaz.instill.environment;

import dev.fumaz.instill.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SystemEnvironmentProbeTest {

    private final Map<String, String> properties = new HashMap<>();
    private final Map<String, String> variables = new HashMap<>();
    private boolean launcherPresent;

    private SystemEnvironmentProbe probe() {
        return new SystemEnvironmentProbe(properties::get, variables::get, name -> launcherPresent);
    }

    @Test
    void defaultsToProductionWithoutIndicators() {
        assertSame(Environment.PRODUCTION, probe().classify());
    }

    @Test
    void detectsTestHarnessFromLauncherOnClassPath() {
        launcherPresent = true;

        assertSame(Environment.TEST, probe().classify());
    }

    @Test
    void detectsTestHarnessFromSurefireProperty() {
        properties.put(SystemEnvironmentProbe.SUREFIRE_PROPERTY, "target/test-classes");

        assertSame(Environment.TEST, probe().classify());
    }

    @Test
    void detectsTestFromVariable() {
        variables.put(SystemEnvironmentProbe.TEST_VARIABLE, "1");

        assertSame(Environment.TEST, probe().classify());
    }

    @Test
    void previewTakesPrecedenceOverTest() {
        launcherPresent = true;
        properties.put(SystemEnvironmentProbe.TEST_PROPERTY, "true");
        variables.put(SystemEnvironmentProbe.PREVIEW_VARIABLE, "1");

        assertSame(Environment.PREVIEW, probe().classify(), "preview should win over test indicators");
    }

    @Test
    void disabledIndicatorsAreIgnored() {
        properties.put(SystemEnvironmentProbe.PREVIEW_PROPERTY, "false");
        properties.put(SystemEnvironmentProbe.TEST_PROPERTY, "0");

        assertSame(Environment.PRODUCTION, probe().classify());
    }

    @Test
    void explicitSettingWins() {
        launcherPresent = true;
        properties.put(SystemEnvironmentProbe.PREVIEW_PROPERTY, "true");
        variables.put(SystemEnvironmentProbe.ENVIRONMENT_VARIABLE, "production");

        assertSame(Environment.PRODUCTION, probe().classify());

        properties.put(SystemEnvironmentProbe.ENVIRONMENT_PROPERTY, "test");
        assertSame(Environment.TEST, probe().classify(), "the property should win over the variable");
    }

    @Test
    void invalidExplicitSettingFails() {
        properties.put(SystemEnvironmentProbe.ENVIRONMENT_PROPERTY, "qa");

        assertThrows(ConfigurationException.class, () -> probe().classify());
    }

    @Test
    void classificationIsComputedOnce() {
        AtomicInteger lookups = new AtomicInteger();
        SystemEnvironmentProbe probe = new SystemEnvironmentProbe(name -> {
            lookups.incrementAndGet();
            return null;
        }, name -> null, name -> false);

        Environment first = probe.classify();
        int afterFirst = lookups.get();

        assertSame(first, probe.classify());
        assertEquals(afterFirst, lookups.get(), "the classification should be cached by the probe");
    }

    @Test
    void sharedProbeRecognisesThisTestRun() {
        assertNotSame(Environment.PRODUCTION, EnvironmentProbe.system().classify(),
                "a JUnit run should never be classified as production");
    }

}
