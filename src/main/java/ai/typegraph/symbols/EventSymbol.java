package ai.typegraph.symbols;

import java.util.List;

public interface EventSymbol extends MemberSymbol {

    TypeSymbol type();

    default EventSymbol overriddenEvent() {
        return null;
    }

    default List<EventSymbol> explicitInterfaceImplementations() {
        return List.of();
    }
}
