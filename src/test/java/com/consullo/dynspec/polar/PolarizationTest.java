package com.consullo.dynspec.polar;

import com.consullo.dynspec.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for polarization parsing and extraction.
 *
 * @since 1.0
 */
public class PolarizationTest {

  @Test
  @DisplayName("Should give I = 8 and Q = -2 for XX = 3, YY = 5 and no cross terms")
  void extract_DiagonalOnly_StokesIQ() {
    assertThat(Polarization.I.extract(3, 5, 0, 0)).isEqualTo(8.0);
    assertThat(Polarization.Q.extract(3, 5, 0, 0)).isEqualTo(-2.0);
    assertThat(Polarization.U.extract(3, 5, 0, 0)).isEqualTo(0.0);
    assertThat(Polarization.V.extract(3, 5, 0, 0)).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should derive U, V and L from the cross terms")
  void extract_CrossTerms_StokesUVL() {
    assertThat(Polarization.U.extract(4, 1, 2, -0.5)).isEqualTo(4.0);
    assertThat(Polarization.V.extract(4, 1, 2, -0.5)).isEqualTo(-1.0);
    assertThat(Polarization.L.extract(4, 1, 2, -0.5)).isEqualTo(5.0);
    assertThat(Polarization.XX.extract(4, 1, 2, -0.5)).isEqualTo(4.0);
    assertThat(Polarization.YY.extract(4, 1, 2, -0.5)).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should read letters, XX/YY tokens and comma lists case-insensitively")
  void parseAll_Selectors_InRequestOrder() {
    assertThat(Polarization.parseAll("iqV")).containsExactly(Polarization.I, Polarization.Q, Polarization.V);
    assertThat(Polarization.parseAll("xx")).containsExactly(Polarization.XX);
    assertThat(Polarization.parseAll("YY")).containsExactly(Polarization.YY);
    assertThat(Polarization.parseAll("I, xx ,L")).containsExactly(Polarization.I, Polarization.XX, Polarization.L);
  }

  @Test
  @DisplayName("Should reject unknown polarizations")
  void parseAll_Unknown_Throws() {
    assertThatThrownBy(() -> Polarization.parseAll("IZ"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Unsupported polarization");
    assertThatThrownBy(() -> Polarization.parseAll(""))
        .isInstanceOf(ConfigurationException.class);
  }
}
