// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Intrepid nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.driver;

import com.starlight.conduit.message.*;

import javax.annotation.Nonnull;


/**
 * Writes message bodies. Framing (the length prefix) is left to the driver.
 */
public final class MessageEncoder {
	/** "COND" */
	static final int SESSION_INIT_MAGIC = 0x434F4E44;


	private MessageEncoder() {}


	/**
	 * Encode the type and body of a message.
	 *
	 * @throws IllegalArgumentException		If a payload does not match its declared
	 * 										length.
	 */
	public static void encode( @Nonnull IMessage message, @Nonnull DataSink buffer ) {
		buffer.put( message.getType().getID() );

		switch( message.getType() ) {
			case SESSION_INIT:
				encodeSessionInit( ( SessionInitIMessage ) message, buffer );
				break;

			case SESSION_INIT_RESPONSE:
				encodeSessionInitResponse( ( SessionInitResponseIMessage ) message, buffer );
				break;

			case SESSION_CLOSE:
				buffer.putUtf8String( ( ( SessionCloseIMessage ) message ).getReason() );
				break;

			case TRANSACT:
				encodeTransact( ( TransactIMessage ) message, buffer );
				break;

			case REPLY:
				encodeReply( ( ReplyIMessage ) message, buffer );
				break;

			case ACQUIRE:
			case RELEASE:
				encodeObjectRef( ( ObjectRefIMessage ) message, buffer );
				break;

			case THREAD_COUNT:
				buffer.putInt( ( ( ThreadCountIMessage ) message ).getMaxThreads() );
				break;

			default:
				throw new UnsupportedOperationException(
					"Unknown message type: " + message.getType() );
		}
	}


	private static void encodeSessionInit( SessionInitIMessage message,
		DataSink buffer ) {

		buffer.putInt( SESSION_INIT_MAGIC );
		buffer.put( message.getMinProtocolVersion() );
		buffer.put( message.getPrefProtocolVersion() );
		buffer.putLong( message.getSessionID() );
		buffer.put( message.isReverse() ? 1 : 0 );
		buffer.putInt( message.getMaxReverseThreads() );
	}


	private static void encodeSessionInitResponse( SessionInitResponseIMessage message,
		DataSink buffer ) {

		buffer.putInt( message.getStatus() );
		buffer.put( message.getProtocolVersion() );
		buffer.putLong( message.getSessionID() );
		buffer.putInt( message.getMaxThreads() );
	}


	private static void encodeTransact( TransactIMessage message, DataSink buffer ) {
		checkPayload( message.getPayloadLength(), message.getPayload() );

		buffer.prepareForData( 24 + message.getPayloadLength() );
		buffer.putInt( message.getTargetHandle() );
		buffer.putInt( message.getCode() );
		buffer.putInt( message.getFlags() );
		buffer.putLong( message.getOnewaySequence() );
		buffer.putInt( message.getPayloadLength() );
		buffer.put( message.getPayload() );
	}


	private static void encodeReply( ReplyIMessage message, DataSink buffer ) {
		checkPayload( message.getPayloadLength(), message.getPayload() );

		buffer.prepareForData( 8 + message.getPayloadLength() );
		buffer.putInt( message.getStatus() );
		buffer.putInt( message.getPayloadLength() );
		buffer.put( message.getPayload() );
	}


	private static void encodeObjectRef( ObjectRefIMessage message, DataSink buffer ) {
		buffer.putInt( message.getHandle() );
		buffer.put( message.isWeak() ? 1 : 0 );
		buffer.putInt( message.getCount() );
	}


	private static void checkPayload( int declared_length, byte[] payload ) {
		if ( declared_length != payload.length ) {
			throw new IllegalArgumentException( "Declared payload length (" +
				declared_length + ") does not match actual payload size (" +
				payload.length + ")" );
		}
	}
}
