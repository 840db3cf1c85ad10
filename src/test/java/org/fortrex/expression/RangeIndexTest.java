package org.fortrex.expression;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RangeIndexTest
{
	@Test
	void upperBoundOnlyCollapsesToTheBound()
	{
		Expression five = new IntLiteral(5);

		assertThat(RangeIndex.of(null, five)).isSameAs(five);
		assertThat(RangeIndex.of(5)).isEqualTo(new IntLiteral(5));
	}

	@Test
	void otherTripletsStayRanges()
	{
		Expression range = RangeIndex.of(new IntLiteral(1), new IntLiteral(5), new IntLiteral(2));

		assertThat(range).isInstanceOf(RangeIndex.class).hasToString("1:5:2");
		assertThat(RangeIndex.of(new IntLiteral(1), null)).hasToString("1:");
		assertThat(RangeIndex.of(null, null, null)).isEqualTo(RangeIndex.all()).hasToString(":");
	}

	@Test
	void rangeVariantsAreDistinct()
	{
		assertThat(new LoopRange(new IntLiteral(1), new IntLiteral(2)))
				.isNotEqualTo(new Range(new IntLiteral(1), new IntLiteral(2)));
	}
}
