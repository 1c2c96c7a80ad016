package fr.lapetina.sessionpool.driver;

import fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig;

import java.util.Objects;

/**
 * Locations and controls of the target surface used by the identity flow and the job flow.
 */
public record Surface(
        String entryUrl,
        String taskUrl,
        Control loginButton,
        Control identityInput,
        Control secretInput,
        Control nextButton,
        Control tryAgainLink,
        Control consentCheckbox,
        Control readyControl,
        Control promptInput,
        Control submitControl,
        Control workingIndicator,
        Control moreOptions,
        Control exportMenuItem,
        Control formatOption
) {
    public Surface {
        Objects.requireNonNull(entryUrl, "Entry URL is required");
        Objects.requireNonNull(taskUrl, "Task URL is required");
    }

    /**
     * Builds the surface description from the {@code surface} configuration section.
     */
    public static Surface fromConfig(SessionPoolConfig.SurfaceConfig cfg) {
        return new Surface(
                cfg.getEntryUrl(),
                cfg.getTaskUrl(),
                new Control("login", cfg.getLoginButton()),
                new Control("identity", cfg.getIdentityInput()),
                new Control("secret", cfg.getSecretInput()),
                new Control("next", cfg.getNextButton()),
                new Control("try-again", cfg.getTryAgainLink()),
                new Control("consent", cfg.getConsentCheckbox()),
                new Control("ready", cfg.getReadyControl()),
                new Control("prompt", cfg.getPromptInput()),
                new Control("submit", cfg.getSubmitControl()),
                new Control("working", cfg.getWorkingIndicator()),
                new Control("more-options", cfg.getMoreOptions()),
                new Control("export", cfg.getExportMenuItem()),
                new Control("format", cfg.getFormatOption())
        );
    }
}
