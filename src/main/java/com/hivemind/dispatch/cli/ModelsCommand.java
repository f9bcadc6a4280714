package com.hivemind.dispatch.cli;

import com.hivemind.core.llm.BudgetStatus;
import com.hivemind.core.llm.ModelStatus;
import com.hivemind.core.llm.RequestRouter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: hivemind models
 * <p>
 * Shows every configured model with its tier, rate window, cooldown and price,
 * followed by the budget.
 */
@Command(name = "models", mixinStandardHelpOptions = true, description = "Show configured models and budget")
@Component
public class ModelsCommand implements Runnable {

    private final RequestRouter router;

    public ModelsCommand(RequestRouter router) {
        this.router = router;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ModelStatus> models = router.modelStates();
        if (models.isEmpty()) {
            ConsoleOutput.error("No models configured. Set hivemind.router.models and a provider API key.");
            return;
        }

        ConsoleOutput.info("Providers: " + String.join(", ", router.providerNames()));
        System.out.println();
        System.out.printf("  %-2s %-32s %-10s %-8s %-9s %-12s %s%n",
                "", "MODEL", "PROVIDER", "TIER", "RPM", "STATE", "$/1M IN/OUT");
        System.out.println("  " + "-".repeat(92));
        for (ModelStatus m : models) {
            System.out.printf("  %-2s %-32s %-10s %-8s %-9s %-12s %.2f/%.2f%n",
                    m.active() ? "*" : "",
                    ConsoleOutput.truncate(m.name(), 32),
                    m.provider(),
                    m.tier(),
                    m.requestsInWindow() + "/" + m.rpmLimit(),
                    state(m),
                    m.costInPer1M(), m.costOutPer1M());
        }

        System.out.println();
        BudgetStatus budget = router.budgetStatus();
        if (budget.limitUsd() > 0) {
            ConsoleOutput.info(String.format("Budget: $%.2f of $%.2f used (%.0f%%)",
                    budget.spentUsd(), budget.limitUsd(), budget.percentUsed()));
        } else {
            ConsoleOutput.info(String.format("Budget: unlimited ($%.2f spent)", budget.spentUsd()));
        }
    }

    private static String state(ModelStatus m) {
        if (m.authFailed()) {
            return "auth-failed";
        }
        if (m.cooledDown()) {
            return "cooldown " + m.cooldownRemaining().toSeconds() + "s";
        }
        return m.hasCapacity() ? "ready" : "rate-limited";
    }
}
