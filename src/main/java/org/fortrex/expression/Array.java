package org.fortrex.expression;

import org.fortrex.expression.visitor.ExpressionVisitor;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.SymbolType;

import java.util.ArrayList;
import java.util.List;

/**
 * An array variable, optionally subscripted.
 * <p>
 * The subscripts used at this reference are the node's {@link #getDimensions() dimensions}. The
 * declared {@link #getShape() shape} belongs to the type and therefore to the scope's table.
 */
public final class Array extends Variable
{
	private ArraySubscript dimensions;

	Array(String name, Scope scope, ArraySubscript dimensions, Expression initial, Variable parent)
	{
		super(name, scope, initial, parent);
		this.dimensions = dimensions;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor)
	{
		return visitor.visitArray(this);
	}

	/**
	 * The subscript of this reference, or null when the whole array is referenced.
	 */
	public ArraySubscript getDimensions()
	{
		return dimensions;
	}

	public void setDimensions(ArraySubscript dimensions)
	{
		this.dimensions = dimensions;
	}

	public boolean hasDimensions()
	{
		return dimensions != null && !dimensions.isEmpty();
	}

	/**
	 * The declared shape, read from the type.
	 */
	public List<Expression> getShape()
	{
		SymbolType type = getType();
		return type == null ? List.of() : type.getShape();
	}

	public void setShape(List<? extends Expression> shape)
	{
		SymbolType type = getType();
		if (type == null)
		{
			throw new IllegalStateException("Cannot set the shape of '" + getName() + "': its scope has been discarded.");
		}
		setType(type.withShape(shape));
	}

	@Override
	public List<Object> getReconstructionArgs()
	{
		List<Object> args = new ArrayList<>(super.getReconstructionArgs());
		if (hasDimensions())
		{
			args.add(dimensions);
		}
		return args;
	}

	@Override
	public Builder toBuilder()
	{
		return builder(getName(), scopeReference())
				.type(getType())
				.dimensions(dimensions)
				.initial(getInitial())
				.parent(getParent())
				.source(getSource());
	}
}
