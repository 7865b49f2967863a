/**
 * EAS decode engine.
 *
 * <p>
 * Serial text flows through three stages:
 * </p>
 * <ul>
 * <li>{@link com.endecrelay.core.decode.FrameAssembler} - frames lines into
 * alert blocks using the ENDEC start/end markers</li>
 * <li>{@link com.endecrelay.core.decode.BlockResolver} - separates message text
 * from the header, including headers split across lines</li>
 * <li>{@link com.endecrelay.core.decode.EasHeaderParser} - strict parser for the
 * fixed-width {@code ZCZC} header</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.endecrelay.core.decode;
