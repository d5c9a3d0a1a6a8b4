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
import java.io.EOFException;
import java.nio.charset.StandardCharsets;


/**
 * Source of encoded message data.
 */
public interface DataSource {
	byte get() throws EOFException;
	short getShort() throws EOFException;
	int getInt() throws EOFException;
	long getLong() throws EOFException;

	void getFully( @Nonnull byte[] destination ) throws EOFException;


	/**
	 * Get a UTF-8 string encoded using the given number of bytes.
	 */
	default @Nonnull String getUtf8String( int length ) throws EOFException {
		byte[] data = new byte[ length ];
		getFully( data );
		return new String( data, StandardCharsets.UTF_8 );
	}


	/**
	 * Returns true when the buffer contains at least byteCount bytes. Returns false if
	 * the source is exhausted before the requested bytes can be read.
	 */
	boolean request( long byte_count );
}
