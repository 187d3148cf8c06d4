package work.lcod.flow.ast;

import java.util.List;

public record ServicesBlock(List<ServiceDeclaration> declarations, SourceLocation location) {
    public ServicesBlock {
        declarations = List.copyOf(declarations);
    }
}
