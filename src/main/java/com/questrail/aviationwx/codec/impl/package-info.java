/**
 * METAR / TAF Codec Implementation
 * =============================================================================
 *
 * <p>Concrete decoders and text formatters behind the interfaces of
 * {@code com.questrail.aviationwx.codec}.</p>
 *
 * <pre>
 *   String rawText
 *        → ReportScanner.scan
 *        → ReportHeaders          (keyword, modifiers, station, primary time)
 *        → FieldGroupDecoder      (wind / visibility / weather / cloud ...)
 *        → DefaultTafDecoder only: change-group introducers
 *        → MetarRecord | TafRecord
 *        → MetarTextFormatter | TafTextFormatter
 * </pre>
 *
 * <p>The grammar is a small recursive descent keyed on token shape. No
 * decoder reads a token by fixed index.</p>
 *
 * <p>Decoders and formatters are stateless apart from their injected
 * observability sink and clock, and may be shared across threads.</p>
 */
package com.questrail.aviationwx.codec.impl;
