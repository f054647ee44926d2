package io.github.yok.sqlmodelrunner.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CatalogSchemaNamingPolicyTest {

    @Test
    void modelIdentifier_正常ケース_カタログあり_3部構成の名前となること() {
        NamingPolicy policy =
                new CatalogSchemaNamingPolicy("main", "analytics", Set.of("orders"), null);
        assertEquals("main.analytics.orders", policy.modelIdentifier("orders"));
    }

    @Test
    void modelIdentifier_正常ケース_カタログが空白_2部構成の名前となること() {
        NamingPolicy policy =
                new CatalogSchemaNamingPolicy("  ", " analytics ", Set.of("orders"), Map.of());
        assertEquals("analytics.orders", policy.modelIdentifier("orders"));
    }

    @Test
    void resolve_正常ケース_ソース名_設定された識別子が返ること() {
        NamingPolicy policy = new CatalogSchemaNamingPolicy("main", "analytics", Set.of(),
                Map.of("raw_events", "main.raw.events"));
        assertEquals(Optional.of("main.raw.events"), policy.resolve("raw_events"));
    }

    @Test
    void resolve_正常ケース_モデルとソースが同名_モデルが優先されること() {
        NamingPolicy policy = new CatalogSchemaNamingPolicy(null, "analytics",
                Set.of("orders"), Map.of("orders", "raw.orders"));
        assertEquals(Optional.of("analytics.orders"), policy.resolve("orders"));
    }

    @Test
    void resolve_正常ケース_未知の名前_空が返ること() {
        NamingPolicy policy = new CatalogSchemaNamingPolicy(null, "s", Set.of("a"), Map.of());
        assertTrue(policy.resolve("b").isEmpty());
    }

    @Test
    void コンストラクタ_異常ケース_スキーマ未指定_例外が送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new CatalogSchemaNamingPolicy("main", " ", Set.of(), Map.of()));
    }
}
