package io.surfworks.dnnforge.backend.cudnn;

/**
 * The three equivalent operator graphs an accelerated convolution can lower to.
 */
public enum ConvolutionLowering {
    /** Forward convolution on contiguous copies of the operands. */
    FORWARD,
    /** A valid unit-stride convolution computed as the filter gradient of a swapped-axis convolution. */
    WEIGHT_GRADIENT_ADJOINT,
    /** A full unit-stride convolution computed as the image gradient of a valid convolution. */
    INPUT_GRADIENT_ADJOINT
}
