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

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;


/**
 * Destination for encoded message data.
 */
public interface DataSink {
	void put( int value );
	void putShort( short value );
	void putInt( int value );
	void putLong( long value );

	void put( @Nonnull byte[] data, int offset, int length );

	default void put( @Nonnull byte[] data ) {
		put( data, 0, data.length );
	}


	/**
	 * Put a UTF-8 encoded string with the byte length prepended.
	 *
	 * @return the number of bytes encoded, not including the length
	 */
	default int putUtf8String( @Nonnull String value ) {
		byte[] str_data = value.getBytes( StandardCharsets.UTF_8 );
		putInt( str_data.length );
		put( str_data, 0, str_data.length );
		return str_data.length;
	}


	/**
	 * Announces to the sink that the given amount of data is about to be provided to it.
	 * This can optionally do things like size internal buffers.
	 */
	default void prepareForData( int length ) {}
}
