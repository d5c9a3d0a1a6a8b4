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

package com.starlight.conduit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;


/**
 * Delivers a transaction to the handler of a local object.
 */
final class TransactionDispatcher {
	private static final Logger LOG =
		LoggerFactory.getLogger( TransactionDispatcher.class );


	private TransactionDispatcher() {}


	static int dispatch( @Nonnull LocalObject target, int code, @Nonnull Parcel data,
		@Nonnull Parcel reply, int flags ) {

		if ( code == RemoteObject.PING_TRANSACTION ) return Status.OK;

		if ( code == RemoteObject.INTERFACE_TRANSACTION ) {
			reply.writeString( target.getInterfaceDescriptor() );
			return Status.OK;
		}

		TransactionHandler<? super LocalObject> handler =
			target.getRegistry().lookup( target );
		if ( handler == null ) {
			LOG.debug( "No handler registered for {} (code {})", target, code );
			return Status.UNKNOWN_TRANSACTION;
		}

		try {
			return handler.onTransact( target, code, data, reply, flags );
		}
		catch( RuntimeException ex ) {
			LOG.warn( "Handler for {} threw an exception for code {}", target, code, ex );
			return Status.UNKNOWN_ERROR;
		}
	}
}
