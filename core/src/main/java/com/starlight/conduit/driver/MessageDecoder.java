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

import com.starlight.conduit.exception.ProtocolException;
import com.starlight.conduit.message.*;

import javax.annotation.Nonnull;
import java.io.EOFException;


/**
 * Reads a single message from a source containing exactly one frame body (the length
 * prefix having already been removed by the driver). Any problem with the data is
 * reported as a {@link ProtocolException}, which is fatal for the connection.
 */
public final class MessageDecoder {
	private MessageDecoder() {}


	@Nonnull
	public static IMessage decode( @Nonnull DataSource buffer ) throws ProtocolException {
		IMessage message;
		try {
			byte type_id = buffer.get();
			IMessageType type = IMessageType.findByID( type_id );
			if ( type == null ) {
				throw new ProtocolException( "Unknown message type: " + type_id );
			}

			switch( type ) {
				case SESSION_INIT:
					message = decodeSessionInit( buffer );
					break;

				case SESSION_INIT_RESPONSE:
					message = new SessionInitResponseIMessage( buffer.getInt(),
						buffer.get(), buffer.getLong(), buffer.getInt() );
					break;

				case SESSION_CLOSE:
					message = new SessionCloseIMessage( getString( buffer ) );
					break;

				case TRANSACT:
				{
					int handle = buffer.getInt();
					int code = buffer.getInt();
					int flags = buffer.getInt();
					long oneway_sequence = buffer.getLong();
					if ( oneway_sequence < 0 ) {
						throw new ProtocolException(
							"Invalid one-way sequence: " + oneway_sequence );
					}
					byte[] payload = getPayload( buffer );
					message = new TransactIMessage( handle, code, flags, oneway_sequence,
						payload );
					break;
				}

				case REPLY:
				{
					int status = buffer.getInt();
					message = new ReplyIMessage( status, getPayload( buffer ) );
					break;
				}

				case ACQUIRE:
				case RELEASE:
				{
					int handle = buffer.getInt();
					boolean weak = getBoolean( buffer );
					int count = buffer.getInt();
					if ( count < 0 ) throw new ProtocolException( "Invalid count: " + count );

					if ( type == IMessageType.ACQUIRE ) {
						message = new AcquireIMessage( handle, weak, count );
					}
					else message = new ReleaseIMessage( handle, weak, count );
					break;
				}

				case THREAD_COUNT:
				{
					int count = buffer.getInt();
					if ( count < 0 ) {
						throw new ProtocolException( "Invalid thread count: " + count );
					}
					message = new ThreadCountIMessage( count );
					break;
				}

				default:
					throw new ProtocolException( "Unhandled message type: " + type );
			}
		}
		catch( EOFException ex ) {
			throw new ProtocolException( "Truncated message", ex );
		}

		if ( buffer.request( 1 ) ) {
			throw new ProtocolException( "Unexpected data after " + message.getType() +
				" message" );
		}

		return message;
	}


	private static IMessage decodeSessionInit( DataSource buffer )
		throws EOFException, ProtocolException {

		int magic = buffer.getInt();
		if ( magic != MessageEncoder.SESSION_INIT_MAGIC ) {
			throw new ProtocolException( "Invalid magic: " + Integer.toHexString( magic ) );
		}

		byte min_version = buffer.get();
		byte pref_version = buffer.get();
		long session_id = buffer.getLong();
		boolean reverse = getBoolean( buffer );
		int reverse_threads = buffer.getInt();
		if ( reverse_threads < 0 ) {
			throw new ProtocolException( "Invalid reverse thread count: " + reverse_threads );
		}

		return new SessionInitIMessage( min_version, pref_version, session_id, reverse,
			reverse_threads );
	}


	private static byte[] getPayload( DataSource buffer )
		throws EOFException, ProtocolException {

		int length = buffer.getInt();
		if ( length < 0 ) throw new ProtocolException( "Invalid payload length: " + length );
		// Check before allocating so a bogus length can't cause a huge allocation
		if ( !buffer.request( length ) ) {
			throw new ProtocolException( "Payload length (" + length +
				") exceeds available data" );
		}

		byte[] payload = new byte[ length ];
		buffer.getFully( payload );
		return payload;
	}


	private static String getString( DataSource buffer )
		throws EOFException, ProtocolException {

		int length = buffer.getInt();
		if ( length < 0 || !buffer.request( length ) ) {
			throw new ProtocolException( "Invalid string length: " + length );
		}
		return buffer.getUtf8String( length );
	}


	private static boolean getBoolean( DataSource buffer )
		throws EOFException, ProtocolException {

		byte value = buffer.get();
		if ( value == 0 ) return false;
		if ( value == 1 ) return true;
		throw new ProtocolException( "Invalid boolean value: " + value );
	}
}
