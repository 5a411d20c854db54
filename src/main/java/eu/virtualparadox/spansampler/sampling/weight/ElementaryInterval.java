package eu.virtualparadox.spansampler.sampling.weight;

import java.util.BitSet;

/**
 * A maximal byte range over which the set of covering candidates does not change.
 *
 * @param start    inclusive start offset
 * @param end      exclusive end offset
 * @param covering indices of the candidates covering every byte of the range
 */
record ElementaryInterval(int start, int end, BitSet covering) {
}
