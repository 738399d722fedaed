package com.stattools.internal.tools;

import com.stattools.classification.ClassificationRuleSet;
import com.stattools.classification.load.ClassificationRuleSetLoader;
import com.stattools.config.StatToolsConfig;
import com.stattools.formula.QuoteStyle;
import com.stattools.tool.classify.ClassifyColumnToolProvider;
import com.stattools.tool.columns.CleanColumnNamesToolProvider;
import com.stattools.tool.formula.ResolveFormulaToolProvider;
import com.stattools.tools.ToolProvider;
import com.stattools.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Registers the built-in tools with a {@link ToolRegistry}. The classification rule set is loaded here,
 * once, from the paths in {@link StatToolsConfig}; the tools receive the built objects.
 */
public final class InternalTools {

    private static final Logger log = LoggerFactory.getLogger(InternalTools.class);

    private InternalTools() {
    }

    /**
     * Loads the classification rule set and registers all internal tool providers.
     *
     * @param registry registry to populate
     * @param config   tool-layer configuration
     * @return number of tools registered
     */
    public static int registerInternalTools(ToolRegistry registry, StatToolsConfig config) {
        Optional<ClassificationRuleSet> ruleSet = new ClassificationRuleSetLoader(config.getClassificationDefaultLabel())
                .load(config.getClassificationRulePaths());
        return registerInternalTools(registry, config, ruleSet);
    }

    /**
     * Registers all internal tool providers with an already loaded rule set.
     *
     * @param ruleSet rule set; empty = classification passes rows through
     * @return number of tools registered
     */
    public static int registerInternalTools(ToolRegistry registry, StatToolsConfig config,
                                            Optional<ClassificationRuleSet> ruleSet) {
        if (registry == null || config == null) return 0;
        QuoteStyle quoteStyle = QuoteStyle.fromName(config.getFormulaQuoteStyle());
        int count = 0;
        count += register(registry, new ResolveFormulaToolProvider(quoteStyle));
        count += register(registry, new CleanColumnNamesToolProvider());
        count += register(registry, new ClassifyColumnToolProvider(ruleSet,
                config.getClassificationColumn(), config.getClassificationLabelColumn()));
        log.info("Registered {} internal tool(s); classification rule set {}", count,
                ruleSet.isPresent() ? "loaded" : "unavailable");
        return count;
    }

    private static int register(ToolRegistry registry, ToolProvider provider) {
        if (provider != null && provider.isEnabled()) {
            registry.register(provider);
            return 1;
        }
        return 0;
    }
}
