package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for rule tables using CDI-based discovery.
 * Every {@link RuleTableProvider} bean contributes the table of one direct conversion; multi-hop
 * conversions are chained by the caller.
 */
@ApplicationScoped
public class RuleTableRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuleTableRegistry.class);

    @Inject
    Instance<RuleTableProvider> providerInstances;

    private final Map<String, RuleTable> tables = new LinkedHashMap<>();

    /**
     * Registry with the built-in directions, for use outside the container.
     */
    public static RuleTableRegistry withDefaults() {
        RuleTableRegistry registry = new RuleTableRegistry();
        registry.register(new VbNetToCSharpRules());
        registry.register(new CSharpToVbNetRules());
        registry.register(new Vb6ToVbNetRules());
        registry.register(new VbNetToVb6Rules());
        return registry;
    }

    @PostConstruct
    public void initialize() {
        log.info("Initializing RuleTableRegistry and discovering rule table providers");

        for (RuleTableProvider provider : providerInstances) {
            register(provider);
        }

        log.info("RuleTableRegistry initialization completed. Registered {} directions", tables.size());
        if (tables.isEmpty()) {
            log.warn("No rule tables were discovered. Check that providers are annotated with a CDI scope.");
        }
    }

    public void register(RuleTableProvider provider) {
        String key = createKey(provider.getSource(), provider.getTarget());
        RuleTable table;
        try {
            table = provider.createTable();
        } catch (TranspileException e) {
            log.error("Invalid rule table {} from {}: {}", key, provider.getClass().getSimpleName(), e.getDetailedMessage());
            throw e;
        }
        RuleTable previous = tables.put(key, table);
        if (previous != null) {
            log.warn("Rule table {} registered twice, {} replaces the earlier one", key, provider.getClass().getSimpleName());
        }
        log.info("Registered rule table: {} ({} rules)", key, table.getRules().size());
    }

    /**
     * Finds the table of a direct conversion.
     *
     * @param source Source language
     * @param target Target language
     * @return The table, or empty if the pair has no direct rules
     */
    public Optional<RuleTable> find(Language source, Language target) {
        return Optional.ofNullable(tables.get(createKey(source, target)));
    }

    public boolean supports(Language source, Language target) {
        return tables.containsKey(createKey(source, target));
    }

    /**
     * @return Direct conversions in registration order, as "SOURCE_TARGET" keys
     */
    public List<String> getRegisteredDirections() {
        return new ArrayList<>(tables.keySet());
    }

    private static String createKey(Language source, Language target) {
        return source.name() + "_" + target.name();
    }
}
