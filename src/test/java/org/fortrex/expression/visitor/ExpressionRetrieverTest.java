package org.fortrex.expression.visitor;

import org.fortrex.expression.*;
import org.fortrex.parser.ExpressionParser;
import org.fortrex.semantic.symbol.Scope;
import org.fortrex.semantic.type.DataType;
import org.fortrex.semantic.type.SymbolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExpressionRetrieverTest
{
	private Scope scope;

	@BeforeEach
	void setUp()
	{
		scope = new Scope("routine");
		scope.assign("A", SymbolType.array(DataType.REAL, null, List.of(RangeIndex.all())));
	}

	@Test
	void findsVariablesInPreOrderWithoutDuplicates()
	{
		Expression expression = ExpressionParser.parse("X + A(I) * X - Y", scope);

		List<Variable> variables = ExpressionRetriever.findVariables(expression);

		assertThat(variables).extracting(Variable::getName).containsExactly("X", "A", "I", "Y");
	}

	@Test
	void variablesDifferingOnlyInCaseAreFoundOnce()
	{
		Expression expression = ExpressionParser.parse("i + 1 + I", scope);

		assertThat(ExpressionRetriever.findVariables(expression)).extracting(Variable::getName).containsExactly("i");
	}

	@Test
	void findsLiterals()
	{
		Expression expression = ExpressionParser.parse("2 * X + FOO(1.0, .true.)", scope);

		assertThat(ExpressionRetriever.findLiterals(expression))
				.containsExactly(new IntLiteral(2), new FloatLiteral("1.0"), new LogicLiteral(true));
	}

	@Test
	void recurseQueryPrunesSubtrees()
	{
		Expression expression = ExpressionParser.parse("A(I) + J", scope);

		List<Expression> found = new ExpressionRetriever(Variable.class::isInstance, e -> !(e instanceof Array))
				.retrieve(expression);

		assertThat(found).extracting(e -> ((Variable) e).getName()).containsExactly("A", "J");
	}

	@Test
	void queryCanSelectNodeTypes()
	{
		Expression expression = ExpressionParser.parse("A(1:N) * B / C", scope);

		assertThat(new ExpressionRetriever(Range.class::isInstance).retrieve(expression))
				.singleElement()
				.hasToString("1:N");
		assertThat(new ExpressionRetriever(Quotient.class::isInstance).retrieve(expression)).hasSize(1);
	}
}
