package org.eqlogic.errors;

/**
 * 位置没有指向项中的合法子项。
 */
public class PositionOutOfBoundsException extends EquationalException {

    public PositionOutOfBoundsException(String message) {
        super(ErrorKind.POSITION_OUT_OF_BOUNDS, message);
    }
}
