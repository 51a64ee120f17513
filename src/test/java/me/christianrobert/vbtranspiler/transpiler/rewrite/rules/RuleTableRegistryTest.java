package me.christianrobert.vbtranspiler.transpiler.rewrite.rules;

import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTableProvider;
import me.christianrobert.vbtranspiler.transpiler.rewrite.dialect.VbToCSharpDialect;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteRule.rule;
import static org.junit.jupiter.api.Assertions.*;

class RuleTableRegistryTest {

    @Test
    void withDefaults_registersFourDirections() {
        RuleTableRegistry registry = RuleTableRegistry.withDefaults();

        assertEquals(List.of("VBNET_CSHARP", "CSHARP_VBNET", "VB6_VBNET", "VBNET_VB6"),
                registry.getRegisteredDirections());
        assertTrue(registry.supports(Language.VB6, Language.VBNET));
        assertFalse(registry.supports(Language.VB6, Language.CSHARP));
        assertTrue(registry.find(Language.CSHARP, Language.VB6).isEmpty());
        assertEquals(Language.CSHARP, registry.find(Language.VBNET, Language.CSHARP).get().getTarget());
    }

    @Test
    void register_rejectsRuleWithoutTemplateThatDoesNotClose() {
        RuleTableRegistry registry = new RuleTableRegistry();
        RuleTableProvider broken = new RuleTableProvider() {
            @Override
            public Language getSource() {
                return Language.VBNET;
            }

            @Override
            public Language getTarget() {
                return Language.CSHARP;
            }

            @Override
            public RuleTable createTable() {
                return new RuleTable(Language.VBNET, Language.CSHARP, List.of(rule("^Stop$", null)),
                        Collections.emptyList(), new VbToCSharpDialect(), null);
            }
        };

        assertThrows(TranspileException.class, () -> registry.register(broken));
        assertTrue(registry.getRegisteredDirections().isEmpty());
    }
}
