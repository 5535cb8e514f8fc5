package dev.fumaz.instill.environment;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Classifies the running process from system properties, environment variables and the class path.
 * <p>
 * An explicit {@value #ENVIRONMENT_PROPERTY} property (or {@value #ENVIRONMENT_VARIABLE} variable) wins. Otherwise a
 * preview indicator selects {@link Environment#PREVIEW}, a test indicator selects {@link Environment#TEST}, and
 * anything else is {@link Environment#PRODUCTION}. The classification is computed once per probe.
 */
public final class SystemEnvironmentProbe implements EnvironmentProbe {

    public static final String ENVIRONMENT_PROPERTY = "instill.environment";
    public static final String ENVIRONMENT_VARIABLE = "INSTILL_ENVIRONMENT";
    public static final String PREVIEW_PROPERTY = "instill.preview";
    public static final String PREVIEW_VARIABLE = "INSTILL_PREVIEW";
    public static final String TEST_PROPERTY = "instill.test";
    public static final String TEST_VARIABLE = "INSTILL_TEST";

    static final String SUREFIRE_PROPERTY = "surefire.test.class.path";
    static final String JUNIT_LAUNCHER = "org.junit.platform.launcher.Launcher";

    private static final Logger LOGGER = Logger.getLogger(SystemEnvironmentProbe.class.getName());
    private static final SystemEnvironmentProbe SHARED = new SystemEnvironmentProbe();

    private final @NotNull Function<String, String> properties;
    private final @NotNull Function<String, String> variables;
    private final @NotNull Predicate<String> classPresent;
    private final Object lock = new Object();
    private volatile Environment environment;

    public SystemEnvironmentProbe() {
        this(System::getProperty, System::getenv, SystemEnvironmentProbe::isClassPresent);
    }

    SystemEnvironmentProbe(@NotNull Function<String, String> properties,
                           @NotNull Function<String, String> variables,
                           @NotNull Predicate<String> classPresent) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.variables = Objects.requireNonNull(variables, "variables");
        this.classPresent = Objects.requireNonNull(classPresent, "classPresent");
    }

    static @NotNull SystemEnvironmentProbe shared() {
        return SHARED;
    }

    @Override
    public @NotNull Environment classify() {
        Environment local = environment;

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = environment;

            if (local == null) {
                local = detect();
                environment = local;
            }

            return local;
        }
    }

    private Environment detect() {
        String explicit = setting(ENVIRONMENT_PROPERTY, ENVIRONMENT_VARIABLE);

        if (explicit != null && !explicit.isBlank()) {
            Environment configured = Environment.parse(explicit);
            LOGGER.fine(() -> "Environment configured explicitly as " + configured);
            return configured;
        }

        if (isEnabled(setting(PREVIEW_PROPERTY, PREVIEW_VARIABLE))) {
            LOGGER.fine("Preview indicator present, classified environment as PREVIEW");
            return Environment.PREVIEW;
        }

        if (isTestHarness()) {
            LOGGER.fine("Test harness detected, classified environment as TEST");
            return Environment.TEST;
        }

        LOGGER.fine("No environment indicator present, classified environment as PRODUCTION");
        return Environment.PRODUCTION;
    }

    private boolean isTestHarness() {
        if (isEnabled(setting(TEST_PROPERTY, TEST_VARIABLE))) {
            return true;
        }

        if (properties.apply(SUREFIRE_PROPERTY) != null) {
            return true;
        }

        return classPresent.test(JUNIT_LAUNCHER);
    }

    private @Nullable String setting(String property, String variable) {
        String value = properties.apply(property);

        if (value != null) {
            return value;
        }

        return variables.apply(variable);
    }

    private static boolean isEnabled(@Nullable String value) {
        if (value == null) {
            return false;
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1");
    }

    private static boolean isClassPresent(String name) {
        try {
            Class.forName(name, false, SystemEnvironmentProbe.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

}
