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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;


/**
 * A single duplex byte stream managed by a driver.
 */
public interface DriverConnection {
	/**
	 * Write a message. Concurrent sends never interleave. Unless called from one of
	 * the driver's IO threads, this blocks until the message has been written to the
	 * underlying socket.
	 *
	 * @throws IOException		If the connection is closed or the write fails.
	 */
	void send( @Nonnull IMessage message ) throws IOException;

	/**
	 * Close the connection. Calling this more than once has no effect.
	 */
	void close();

	boolean isOpen();


	/**
	 * Object associated with the connection by the layer above the driver.
	 */
	@Nullable Object getAttachment();

	void setAttachment( @Nullable Object attachment );


	/**
	 * Description of the remote address, for logging.
	 */
	@Nonnull String getRemoteAddressDescription();
}
