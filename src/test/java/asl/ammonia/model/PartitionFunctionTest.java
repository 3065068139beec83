package asl.ammonia.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PartitionFunctionTest {

  @Test
  public void levelsSplitIntoOrthoAndPara() {
    PartitionFunction partition = new PartitionFunction(20.);
    assertEquals(17, partition.getOrthoWeights().length);
    assertEquals(34, partition.getParaWeights().length);
  }

  @Test
  public void groundOrthoLevel_hasDoubledWeight() {
    // J = 0 has no energy, so only the statistical weight remains
    PartitionFunction partition = new PartitionFunction(30.);
    assertEquals(2.0, partition.getOrthoWeights()[0], 1E-15);
  }

  @Test
  public void firstParaLevel_matchesBoltzmannFactor() {
    double tkin = 25.;
    PartitionFunction partition = new PartitionFunction(tkin);
    double energy = PhysicalConstants.PLANCK
        * (PartitionFunction.B_ROT * 2 + (PartitionFunction.C_ROT - PartitionFunction.B_ROT));
    double expected = 3 * Math.exp(-energy / (PhysicalConstants.BOLTZMANN * tkin));
    assertEquals(expected, partition.getParaWeights()[0], expected * 1E-12);
  }

  @Test
  public void branchFractions_sumToOne() {
    PartitionFunction partition = new PartitionFunction(40.);
    double orthoTotal = 0.;
    for (int i = 0; i < partition.getOrthoWeights().length; ++i) {
      orthoTotal += partition.getOrthoFraction(i);
    }
    double paraTotal = 0.;
    for (int i = 0; i < partition.getParaWeights().length; ++i) {
      paraTotal += partition.getParaFraction(i);
    }
    assertEquals(1.0, orthoTotal, 1E-12);
    assertEquals(1.0, paraTotal, 1E-12);
  }

  @Test
  public void coldGas_sitsInLowestParaLevel() {
    PartitionFunction partition = new PartitionFunction(5.);
    assertTrue(partition.getLevelFraction(Transition.ONE_ONE) > 0.99);
  }

  @Test
  public void warmerGas_depopulatesOneOne() {
    double cold = new PartitionFunction(10.).getLevelFraction(Transition.ONE_ONE);
    double warm = new PartitionFunction(50.).getLevelFraction(Transition.ONE_ONE);
    assertTrue(warm < cold);
    double coldFourFour = new PartitionFunction(10.).getLevelFraction(Transition.FOUR_FOUR);
    double warmFourFour = new PartitionFunction(50.).getLevelFraction(Transition.FOUR_FOUR);
    assertTrue(warmFourFour > coldFourFour);
  }

  @Test
  public void levelFraction_usesBranchOfTransition() {
    PartitionFunction partition = new PartitionFunction(20.);
    assertEquals(partition.getOrthoFraction(1),
        partition.getLevelFraction(Transition.THREE_THREE), 0.);
    assertEquals(partition.getParaFraction(1),
        partition.getLevelFraction(Transition.TWO_TWO), 0.);
    assertEquals(20., partition.getKineticTemperature(), 0.);
  }
}
