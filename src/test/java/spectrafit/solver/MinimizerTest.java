/**
 * SpectraFit
 * MinimizerTest.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.exception.UnknownMethodException;

class MinimizerTest {

	@Test
	void resolvesNamesAndAliases() {
		assertThat(Minimizer.fromName("leastsq")).isEqualTo(Minimizer.LEASTSQ);
		assertThat(Minimizer.fromName(" Least_Squares ")).isEqualTo(
			Minimizer.LEASTSQ);
		assertThat(Minimizer.fromName("nelder_mead")).isEqualTo(Minimizer.NELDER);
		assertThat(Minimizer.DIFFERENTIAL_EVOLUTION.key()).isEqualTo(
			"differential_evolution");
		assertThat(Minimizer.fromName("EMCEE")).isEqualTo(Minimizer.EMCEE);
		assertThat(Minimizer.GAUSS_NEWTON.isLeastSquares()).isTrue();
		assertThat(Minimizer.POWELL.isLeastSquares()).isFalse();
	}

	@Test
	void rejectsUnknownMethods() {
		assertThatThrownBy(() -> Minimizer.fromName("ampgo")).isInstanceOf(
			UnknownMethodException.class).hasMessage(
				"Unknown minimization method: 'ampgo'");
		assertThatThrownBy(() -> Minimizer.fromName(null)).isInstanceOf(
			UnknownMethodException.class);
	}

	@Test
	void nanPolicyNames() {
		assertThat(NanPolicy.fromString("OMIT")).isEqualTo(NanPolicy.OMIT);
		assertThat(NanPolicy.RAISE.key()).isEqualTo("raise");
		assertThatThrownBy(() -> NanPolicy.fromString("drop")).isInstanceOf(
			InvalidSettingsException.class);
	}
}
