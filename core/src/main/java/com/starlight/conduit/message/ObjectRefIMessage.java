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

package com.starlight.conduit.message;

/**
 * Base for the messages that adjust the reference counts an object's owner keeps on
 * behalf of the peer.
 */
public abstract class ObjectRefIMessage implements IMessage {
	private final int handle;
	private final boolean weak;
	private final int count;


	ObjectRefIMessage( int handle, boolean weak, int count ) {
		if ( count < 0 ) throw new IllegalArgumentException( "Invalid count: " + count );

		this.handle = handle;
		this.weak = weak;
		this.count = count;
	}


	public int getHandle() {
		return handle;
	}

	public boolean isWeak() {
		return weak;
	}

	/**
	 * For strong references, the number of sends of the object being acknowledged.
	 * For weak references this is always one.
	 */
	public int getCount() {
		return count;
	}


	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" +
			"handle=" + handle +
			", weak=" + weak +
			", count=" + count +
			'}';
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		ObjectRefIMessage that = ( ObjectRefIMessage ) o;

		if ( handle != that.handle ) return false;
		if ( weak != that.weak ) return false;
		return count == that.count;
	}

	@Override
	public int hashCode() {
		int result = handle;
		result = 31 * result + ( weak ? 1 : 0 );
		result = 31 * result + count;
		return result;
	}
}
