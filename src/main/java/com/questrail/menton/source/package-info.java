/**
 * Menton Source Layer
 * =============================================================================
 *
 * <p>Turns raw program text into the logical lines every later stage works on.
 * This layer knows nothing about markers, statements or symbols.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] / String
 *        → SourceText.decodeUtf8          (strict UTF-8, bytes only)
 *        → SourcePreprocessor.preprocess  (newline token, comments, trimming)
 *            → List&lt;LogicalLine&gt;
 *                → BlockParser
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Line numbers always refer to physical lines of the source text.</li>
 *   <li>Blank lines never reach the parser.</li>
 * </ul>
 */
package com.questrail.menton.source;
