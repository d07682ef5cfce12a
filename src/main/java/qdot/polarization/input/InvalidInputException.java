package qdot.polarization.input;

/**
 * Thrown when a polarization line cannot be fit as given: the detuning and signal series differ
 * in length, are empty, hold fewer samples than the model has free parameters, or contain
 * non-finite values. Raised before any solver iteration takes place.
 */
public class InvalidInputException extends IllegalArgumentException {

  private static final long serialVersionUID = 2390843172601943812L;

  public InvalidInputException(String message) {
    super(message);
  }

}
