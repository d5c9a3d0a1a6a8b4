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

import com.starlight.conduit.message.IMessage;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.ObjectOutputStream;


/**
 * Throwable to indicate that the driver should close the connection.
 * <p>
 * This class will be serializable due to class hierarchy, but does not support
 * serialization. If an attempt is made to serialize it, an exception will be thrown.
 */
@SuppressWarnings( "serial" )
public final class CloseConnectionIndicator extends Throwable {
	// There is no serialVersionUID because this class does not support serialization

	private final IMessage reason_message;


	/**
	 * @param reason_message	If non-null, this message will be sent on the connection
	 * 							before closing to describe why it's being closed.
	 * @param description		Description of the problem, for logging.
	 */
	public CloseConnectionIndicator( @Nullable IMessage reason_message,
		@Nullable String description ) {

		super( description, null, false, false );
		this.reason_message = reason_message;
	}


	@Nullable
	public IMessage getReasonMessage() {
		return reason_message;
	}


	// Prevent serialization (since the message isn't serializable and this is meant for
	// internal driver stuff anyway.
	private void writeObject( ObjectOutputStream oos ) throws IOException {
		throw new IOException( "CloseConnectionIndicators should never be serialized" );
	}
}
