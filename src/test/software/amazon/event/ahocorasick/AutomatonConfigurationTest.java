package software.amazon.event.ahocorasick;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AutomatonConfigurationTest {

    @Test
    public void testCaseInsensitiveTrue() {
        assertTrue(new AutomatonConfiguration(true, true).isCaseInsensitive());
    }

    @Test
    public void testCaseInsensitiveFalse() {
        assertFalse(new AutomatonConfiguration(false, true).isCaseInsensitive());
    }

    @Test
    public void testFailureLinkPruningTrue() {
        assertTrue(new AutomatonConfiguration(false, true).isFailureLinkPruning());
    }

    @Test
    public void testFailureLinkPruningFalse() {
        assertFalse(new AutomatonConfiguration(true, false).isFailureLinkPruning());
    }

    @Test
    public void testBuilderDefaults() {
        AutomatonConfiguration configuration = Automaton.builder().buildConfig();
        assertFalse(configuration.isCaseInsensitive());
        assertTrue(configuration.isFailureLinkPruning());
    }

    @Test
    public void testBuilderOptions() {
        Automaton automaton = Automaton.builder()
                .withCaseInsensitive(true)
                .withFailureLinkPruning(false)
                .build();
        assertTrue(automaton.isCaseInsensitive());
        assertFalse(automaton.isFailureLinkPruning());
    }
}
