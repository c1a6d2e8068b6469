package org.minicc.compiler.frontend.irgen;

import org.minicc.compiler.frontend.irgen.converters.AssignExprNodeConverter;
import org.minicc.compiler.frontend.irgen.converters.DeclareArrayNodeConverter;
import org.minicc.compiler.frontend.irgen.converters.DeclareNodeConverter;
import org.minicc.compiler.frontend.irgen.converters.IncludeNodeConverter;
import org.minicc.compiler.frontend.irgen.converters.PrintfNodeConverter;
import org.minicc.compiler.frontend.parser.ast.AssignExprNode;
import org.minicc.compiler.frontend.parser.ast.DeclareArrayNode;
import org.minicc.compiler.frontend.parser.ast.DeclareNode;
import org.minicc.compiler.frontend.parser.ast.IncludeNode;
import org.minicc.compiler.frontend.parser.ast.PrintfNode;
import org.minicc.compiler.frontend.parser.ast.StatementNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping statement node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback for node classes
 * without a registered converter.
 */
public final class IrConverterRegistry {

	private final Map<Class<? extends StatementNode>, IAstNodeToIrConverter<? extends StatementNode>> byClass = new HashMap<>();
	private final IAstNodeToIrConverter<StatementNode> defaultConverter;

	private IrConverterRegistry(IAstNodeToIrConverter<StatementNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given node class.
	 *
	 * @param nodeType  The concrete node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete node type parameter.
	 */
	public <T extends StatementNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Retrieves the converter registered for the given class.
	 *
	 * @param nodeType The node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToIrConverter<? extends StatementNode>> get(Class<? extends StatementNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves the converter for the given node's class, falling back to the default converter.
	 *
	 * @param node The node to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToIrConverter<StatementNode> resolve(StatementNode node) {
		IAstNodeToIrConverter<?> found = byClass.get(node.getClass());
		if (found != null) return (IAstNodeToIrConverter<StatementNode>) found;
		return defaultConverter;
	}

	/**
	 * @return The default/fallback converter used when no specific converter is registered.
	 */
	public IAstNodeToIrConverter<StatementNode> defaultConverter() {
		return defaultConverter;
	}

	/**
	 * Creates an empty registry with the given default converter.
	 *
	 * @param defaultConverter The fallback converter used for unknown node types.
	 * @return A new registry instance.
	 */
	public static IrConverterRegistry initialize(IAstNodeToIrConverter<StatementNode> defaultConverter) {
		return new IrConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and registers all built-in converters.
	 *
	 * @return A registry with a converter for every statement node type.
	 */
	public static IrConverterRegistry initializeWithDefaults() {
		IrConverterRegistry reg = initialize(new DefaultAstNodeToIrConverter());
		reg.register(IncludeNode.class, new IncludeNodeConverter());
		reg.register(DeclareNode.class, new DeclareNodeConverter());
		reg.register(DeclareArrayNode.class, new DeclareArrayNodeConverter());
		reg.register(AssignExprNode.class, new AssignExprNodeConverter());
		reg.register(PrintfNode.class, new PrintfNodeConverter());
		return reg;
	}
}
