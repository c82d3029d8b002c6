/**
 * Report Codec Boundary
 * =============================================================================
 *
 * <p>This package defines the public boundary between raw METAR/TAF text and
 * the typed records of {@code com.questrail.aviationwx.model}.</p>
 *
 * <pre>
 *   String rawText
 *        → ReportScanner           (whitespace tokens, classified by shape)
 *            → ReportDecoder       (METAR or TAF grammar)
 *                → WeatherReport   (immutable record)
 *                    → ReportFormatter
 *                        → List&lt;String&gt; lines
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Station and primary time failures abort the decode with a
 *       {@link com.questrail.aviationwx.codec.ReportDecodeException} subclass.</li>
 *   <li>Every other field degrades to "absent" and is listed in the record's
 *       defects, so one bad token never hides the remaining valid fields.</li>
 *   <li>Formatters never throw.</li>
 * </ul>
 */
package com.questrail.aviationwx.codec;
